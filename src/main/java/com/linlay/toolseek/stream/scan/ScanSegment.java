package com.linlay.toolseek.stream.scan;

/**
 * 扫描结果片段。TEXT 片段携带所在区域（null 表示普通文本）；OPEN/CLOSE/MARKER 是控制事件，tag 为标签名或标记原文。
 */
public record ScanSegment(
        Kind kind,
        String text,
        String region,
        String tag
) {

    public enum Kind {
        TEXT,
        OPEN,
        CLOSE,
        MARKER
    }

    public static ScanSegment text(String text, String region) {
        return new ScanSegment(Kind.TEXT, text, region, null);
    }

    public static ScanSegment open(String name) {
        return new ScanSegment(Kind.OPEN, TagVocabulary.openTag(name), null, name);
    }

    public static ScanSegment close(String name) {
        return new ScanSegment(Kind.CLOSE, TagVocabulary.closeTag(name), null, name);
    }

    public static ScanSegment marker(String marker) {
        return new ScanSegment(Kind.MARKER, marker, null, marker);
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isOpen(String name) {
        return kind == Kind.OPEN && name != null && name.equals(tag);
    }

    public boolean isClose(String name) {
        return kind == Kind.CLOSE && name != null && name.equals(tag);
    }

    public boolean isMarker(String marker) {
        return kind == Kind.MARKER && marker != null && marker.equals(tag);
    }
}
