package org.bpmnbridge.converter.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based field extraction over BPMN-like markup.
 * Every method is total: no match gives null or an empty list, never an exception.
 * Tag names are matched with or without a namespace prefix.
 */
public class MarkupScanner {

    private static final String PREFIX = "(?:\\w+:)?";
    // attribute text of an opening tag that does not close itself, possessive so
    // long attribute values do not recurse once per character
    private static final String OPEN_TAG_ATTRIBUTES = "([^>/]*+(?:/(?!>)[^>/]*+)*+)";

    /**
     * One occurrence of an element: the raw attribute text of its opening tag and
     * its inner markup (empty for self-closing occurrences).
     */
    public record TagMatch(String attributes, String body) {
    }

    /**
     * Finds open/close pairs of the given tag. Occurrences whose attribute text ends
     * with a slash are self-closing in disguise and are skipped.
     */
    public static List<TagMatch> findPairedElements(String text, String tagName) {
        List<TagMatch> matches = new ArrayList<>();
        if (text == null) {
            return matches;
        }
        Pattern pattern = Pattern.compile(
                "<" + PREFIX + Pattern.quote(tagName) + "\\b" + OPEN_TAG_ATTRIBUTES + ">(.*?)</" + PREFIX
                        + Pattern.quote(tagName) + "\\s*>",
                Pattern.DOTALL);
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String attributes = matcher.group(1);
            if (attributes.stripTrailing().endsWith("/")) {
                continue;
            }
            matches.add(new TagMatch(attributes, matcher.group(2)));
        }
        return matches;
    }

    /**
     * Finds self-closing occurrences of the given tag.
     */
    public static List<TagMatch> findSelfClosingElements(String text, String tagName) {
        List<TagMatch> matches = new ArrayList<>();
        if (text == null) {
            return matches;
        }
        Pattern pattern = Pattern.compile("<" + PREFIX + Pattern.quote(tagName) + "\\b([^>]*)/>", Pattern.DOTALL);
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(new TagMatch(matcher.group(1), ""));
        }
        return matches;
    }

    /**
     * Finds paired and self-closing occurrences of the given tag in document order.
     */
    public static List<TagMatch> findElements(String text, String tagName) {
        List<TagMatch> matches = new ArrayList<>();
        if (text == null) {
            return matches;
        }
        Pattern pattern = Pattern.compile(
                "<" + PREFIX + Pattern.quote(tagName) + "\\b" + OPEN_TAG_ATTRIBUTES + "(?:/>|>(.*?)</" + PREFIX
                        + Pattern.quote(tagName) + "\\s*>)",
                Pattern.DOTALL);
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String body = matcher.group(2);
            matches.add(new TagMatch(matcher.group(1), body == null ? "" : body));
        }
        return matches;
    }

    /**
     * Returns the attribute text of the first opening (or self-closing) tag with the given name.
     */
    public static String findOpeningTagAttributes(String text, String tagName) {
        if (text == null) {
            return null;
        }
        Matcher matcher = Pattern.compile("<" + PREFIX + Pattern.quote(tagName) + "\\b([^>]*)>", Pattern.DOTALL)
                .matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String attributes = matcher.group(1).stripTrailing();
        return attributes.endsWith("/") ? attributes.substring(0, attributes.length() - 1) : attributes;
    }

    /**
     * Extracts an attribute value, double or single quoted, with entities decoded.
     *
     * @return the value, or null when the attribute is missing or empty
     */
    public static String extractAttribute(String attributes, String name) {
        if (attributes == null) {
            return null;
        }
        Matcher matcher = Pattern.compile(
                "(?:^|\\s)" + Pattern.quote(name) + "\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')").matcher(attributes);
        if (!matcher.find()) {
            return null;
        }
        String raw = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        return raw.isEmpty() ? null : XmlText.unescape(raw);
    }

    /**
     * Extracts a numeric attribute. Decimal fractions are truncated toward zero,
     * anything that is not a finite number within int range yields null.
     */
    public static Integer extractIntAttribute(String attributes, String name) {
        String value = extractAttribute(attributes, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double number = Double.parseDouble(value.trim());
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return null;
            }
            double truncated = number < 0 ? Math.ceil(number) : Math.floor(number);
            if (truncated < Integer.MIN_VALUE || truncated > Integer.MAX_VALUE) {
                return null;
            }
            return (int) truncated;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Collects the text of every occurrence of a simple text marker such as
     * {@code <bpmn:incoming>Flow_1</bpmn:incoming>}, trimmed, in document order.
     */
    public static List<String> extractMarkerTexts(String body, String markerName) {
        List<String> texts = new ArrayList<>();
        for (TagMatch match : findPairedElements(body, markerName)) {
            texts.add(XmlText.unescape(match.body().trim()));
        }
        return texts;
    }

    /**
     * @return the trimmed text of the first occurrence of the marker, or null
     */
    public static String extractMarkerText(String body, String markerName) {
        List<TagMatch> matches = findPairedElements(body, markerName);
        if (matches.isEmpty()) {
            return null;
        }
        return XmlText.unescape(matches.get(0).body().trim());
    }
}
