package org.mediarenamer.controller;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.mediarenamer.controller.util.StringUtils;

/**
 * Reduces a show title to a key that is equal for titles that name the same show.
 *
 * <p>The title is lower-cased, stripped of punctuation and whitespace-squeezed.
 * Titles of a few franchises that are routinely released under several names
 * are then folded onto one canonical key.
 */
public class TitleNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile(
        "[^\\w\\s]",
        Pattern.UNICODE_CHARACTER_CLASS
    );

    private record Alias(Pattern canonicalWord, List<String> variants) {
    }

    private static final Map<String, Alias> FRANCHISE_ALIASES = buildAliases();

    private static Map<String, Alias> buildAliases() {
        Map<String, List<String>> variants = new LinkedHashMap<>();
        variants.put(
            "smackdown",
            List.of("wwe smackdown", "smackdown live", "friday night smackdown")
        );
        variants.put("raw", List.of("wwe raw", "monday night raw"));
        variants.put("nxt", List.of("wwe nxt", "nxt wrestling"));

        Map<String, Alias> aliases = new LinkedHashMap<>();
        variants.forEach((canonical, names) ->
            aliases.put(
                canonical,
                new Alias(Pattern.compile("\\b" + canonical + "\\b"), names)
            )
        );
        return Collections.unmodifiableMap(aliases);
    }

    /**
     * @param raw a title as found in a directory or file name
     * @return the comparison key; never null
     */
    public String normalize(final String raw) {
        String normalized = StringUtils.toLower(raw);
        normalized = PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = StringUtils.collapseWhitespace(normalized);

        for (Map.Entry<String, Alias> entry : FRANCHISE_ALIASES.entrySet()) {
            Alias alias = entry.getValue();
            if (alias.canonicalWord().matcher(normalized).find()) {
                return entry.getKey();
            }
            for (String variant : alias.variants()) {
                if (normalized.contains(variant)) {
                    return entry.getKey();
                }
            }
        }
        return normalized;
    }
}
