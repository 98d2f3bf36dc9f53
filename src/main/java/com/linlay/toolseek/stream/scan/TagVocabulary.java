package com.linlay.toolseek.stream.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 扫描器识别的标记集合：成对的区域标签（如 {@code <python>...</python>}）以及独立标记（如推理结束标记 {@code </think>}）。
 */
public final class TagVocabulary {

    private final List<String> regionTags;
    private final List<String> markers;
    private final int longestToken;

    public TagVocabulary(List<String> regionTags, List<String> markers) {
        this.regionTags = List.copyOf(compact(regionTags));
        this.markers = List.copyOf(compact(markers));
        int longest = 0;
        for (String tag : this.regionTags) {
            longest = Math.max(longest, closeTag(tag).length());
        }
        for (String marker : this.markers) {
            longest = Math.max(longest, marker.length());
        }
        this.longestToken = longest;
    }

    public static TagVocabulary of(String codeTag, String outputTag, String endOfReasoningMarker) {
        return new TagVocabulary(
                List.of(Objects.requireNonNull(codeTag, "codeTag cannot be null"),
                        Objects.requireNonNull(outputTag, "outputTag cannot be null")),
                endOfReasoningMarker == null ? List.of() : List.of(endOfReasoningMarker)
        );
    }

    public static String openTag(String name) {
        return "<" + name + ">";
    }

    public static String closeTag(String name) {
        return "</" + name + ">";
    }

    public List<String> regionTags() {
        return regionTags;
    }

    public List<String> markers() {
        return markers;
    }

    int longestToken() {
        return longestToken;
    }

    private static List<String> compact(List<String> input) {
        List<String> output = new ArrayList<>();
        if (input == null) {
            return output;
        }
        for (String item : input) {
            if (item == null || item.isEmpty() || output.contains(item)) {
                continue;
            }
            output.add(item);
        }
        return output;
    }
}
