package com.linlay.toolseek.stream.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 增量标签扫描器。
 * <p>
 * 每次 {@link #feed(String)} 只检查尚未消费的缓冲区：先逐个切出完整标签，再把缓冲区末尾可能是某个标签前缀的部分留在
 * pending 中，其余文本按当前区域输出。已输出片段与 pending 拼接后始终等于已输入的全部字符。
 * <p>
 * 未进入区域时识别所有开/闭标签与独立标记；进入某区域后只识别该区域的闭标签。
 * 实例只服务于一条逻辑流，不是线程安全的。
 */
public class TagScanner {

    private final TagVocabulary vocabulary;
    private final StringBuilder pending = new StringBuilder();
    private String activeRegion;

    public TagScanner(TagVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary cannot be null");
    }

    public List<ScanSegment> feed(String chunk) {
        List<ScanSegment> segments = new ArrayList<>();
        if (chunk == null || chunk.isEmpty()) {
            return segments;
        }
        pending.append(chunk);
        drain(segments);
        return segments;
    }

    /**
     * 流结束时调用：未闭合的标签或不完整的标记按当前区域作为普通文本输出。
     */
    public List<ScanSegment> finish() {
        List<ScanSegment> segments = new ArrayList<>();
        if (!pending.isEmpty()) {
            segments.add(ScanSegment.text(pending.toString(), activeRegion));
            pending.setLength(0);
        }
        return segments;
    }

    public String activeRegion() {
        return activeRegion;
    }

    public String pending() {
        return pending.toString();
    }

    private void drain(List<ScanSegment> segments) {
        Match match;
        while ((match = findEarliestToken()) != null) {
            if (match.start() > 0) {
                segments.add(ScanSegment.text(pending.substring(0, match.start()), activeRegion));
            }
            segments.add(match.segment());
            applyTransition(match.segment());
            pending.delete(0, match.start() + match.segment().text().length());
        }

        int holdFrom = holdbackStart();
        if (holdFrom > 0) {
            segments.add(ScanSegment.text(pending.substring(0, holdFrom), activeRegion));
            pending.delete(0, holdFrom);
        }
    }

    private void applyTransition(ScanSegment token) {
        switch (token.kind()) {
            case OPEN -> activeRegion = token.tag();
            case CLOSE -> activeRegion = null;
            default -> {
            }
        }
    }

    private Match findEarliestToken() {
        Match best = null;
        for (ScanSegment candidate : recognizableTokens()) {
            int index = pending.indexOf(candidate.text());
            if (index < 0) {
                continue;
            }
            if (best == null
                    || index < best.start()
                    || (index == best.start() && candidate.text().length() > best.segment().text().length())) {
                best = new Match(index, candidate);
            }
        }
        return best;
    }

    // Earliest index whose suffix is still a proper prefix of a recognizable token; pending.length() when none.
    private int holdbackStart() {
        int length = pending.length();
        int from = Math.max(0, length - vocabulary.longestToken() + 1);
        List<ScanSegment> tokens = recognizableTokens();
        for (int i = from; i < length; i++) {
            String suffix = pending.substring(i);
            for (ScanSegment token : tokens) {
                if (token.text().startsWith(suffix)) {
                    return i;
                }
            }
        }
        return length;
    }

    private List<ScanSegment> recognizableTokens() {
        List<ScanSegment> tokens = new ArrayList<>();
        if (activeRegion != null) {
            tokens.add(ScanSegment.close(activeRegion));
            return tokens;
        }
        for (String tag : vocabulary.regionTags()) {
            tokens.add(ScanSegment.open(tag));
            tokens.add(ScanSegment.close(tag));
        }
        for (String marker : vocabulary.markers()) {
            tokens.add(ScanSegment.marker(marker));
        }
        return tokens;
    }

    private record Match(int start, ScanSegment segment) {
    }
}
