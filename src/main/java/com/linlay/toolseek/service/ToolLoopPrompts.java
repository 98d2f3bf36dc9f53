package com.linlay.toolseek.service;

import com.linlay.toolseek.stream.scan.TagVocabulary;

/**
 * 工具约定说明与续写种子。种子以一个完整的示例代码块开头，引导模型在推理中使用该约定；种子本身不会下发给客户端。
 */
public class ToolLoopPrompts {

    static final String THINK_OPEN = "<think>\n";

    private final String codeTag;
    private final String outputTag;
    private final String endOfReasoningMarker;

    public ToolLoopPrompts(String codeTag, String outputTag, String endOfReasoningMarker) {
        this.codeTag = codeTag;
        this.outputTag = outputTag;
        this.endOfReasoningMarker = endOfReasoningMarker;
    }

    public String instruction() {
        String open = TagVocabulary.openTag(codeTag);
        String close = TagVocabulary.closeTag(codeTag);
        String outOpen = TagVocabulary.openTag(outputTag);
        String outClose = TagVocabulary.closeTag(outputTag);
        return "\n\n---\n"
                + "While thinking you can run Python code. Wrap the code in " + open + " and " + close + " tags. "
                + "The code runs immediately in a persistent Python session (variables survive between blocks) "
                + "and its printed output is inserted right after the block between " + outOpen + " and " + outClose + " tags. "
                + "A bare expression is evaluated and its value shown. Never write " + outOpen + " blocks yourself. "
                + "Use code for arithmetic, data manipulation and checking your work. "
                + "When you are done thinking, write " + endOfReasoningMarker + " and then give the final answer.";
    }

    public String seedPrefix() {
        return THINK_OPEN
                + "I can run Python while I think. Quick check that the tool works:\n"
                + outputExample()
                + "The tool works. Now, the actual question.\n";
    }

    public String formatOutputBlock(String output) {
        return "\n" + TagVocabulary.openTag(outputTag) + "\n"
                + (output == null ? "" : output)
                + "\n" + TagVocabulary.closeTag(outputTag) + "\n";
    }

    private String outputExample() {
        return TagVocabulary.openTag(codeTag) + "\nprint(\"ready\", 2 ** 10)\n" + TagVocabulary.closeTag(codeTag)
                + formatOutputBlock("ready 1024");
    }
}
