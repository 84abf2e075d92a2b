package com.example.compliance.orchestrator;

import com.example.compliance.model.AnalysisBundle;
import com.example.compliance.model.StageName;

import java.util.List;

/**
 * The fixed, ordered list of analysis stages.
 * <p>
 * Inputs per stage:
 * <ul>
 *   <li>requirements: the requirements text</li>
 *   <li>code: the code</li>
 *   <li>tests: the tests and the requirements</li>
 *   <li>documentation: the documentation, the requirements and the code</li>
 *   <li>security: the code</li>
 *   <li>bug-synthesis: the first four stage results and the code</li>
 *   <li>report-synthesis: the bundle and every earlier result</li>
 * </ul>
 */
public final class AnalysisPipeline {

    private static final List<StageDescriptor> STAGES = List.of(
            new StageDescriptor(StageName.REQUIREMENTS, "requirements_analysis", StagePrompts.REQUIREMENTS,
                    ctx -> section("Requirements", ctx.bundle().requirements())),
            new StageDescriptor(StageName.CODE, "code_analysis", StagePrompts.CODE,
                    ctx -> codeSection(ctx.bundle())),
            new StageDescriptor(StageName.TESTS, "test_analysis_result", StagePrompts.TESTS,
                    ctx -> section("Test cases", ctx.bundle().tests())
                            + section("Requirements", ctx.bundle().requirements())),
            new StageDescriptor(StageName.DOCUMENTATION, "documentation_analysis_result", StagePrompts.DOCUMENTATION,
                    ctx -> section("Documentation", ctx.bundle().documentation())
                            + section("Requirements", ctx.bundle().requirements())
                            + codeSection(ctx.bundle())),
            new StageDescriptor(StageName.SECURITY, "security_analysis", StagePrompts.SECURITY,
                    ctx -> codeSection(ctx.bundle())),
            new StageDescriptor(StageName.BUG_SYNTHESIS, "bug_analysis_result", StagePrompts.BUG_SYNTHESIS,
                    ctx -> codeSection(ctx.bundle())
                            + stageSection(ctx, StageName.REQUIREMENTS)
                            + stageSection(ctx, StageName.CODE)
                            + stageSection(ctx, StageName.TESTS)
                            + stageSection(ctx, StageName.DOCUMENTATION)),
            new StageDescriptor(StageName.REPORT_SYNTHESIS, "analyze_compliance", StagePrompts.REPORT_SYNTHESIS,
                    AnalysisPipeline::reportSynthesisPrompt)
    );

    private AnalysisPipeline() {
    }

    public static List<StageDescriptor> stages() {
        return STAGES;
    }

    /** Function schemas the pipeline needs, in stage order. */
    public static List<String> functionNames() {
        return STAGES.stream().map(StageDescriptor::functionName).toList();
    }

    private static String reportSynthesisPrompt(StageContext ctx) {
        AnalysisBundle bundle = ctx.bundle();
        StringBuilder prompt = new StringBuilder()
                .append(section("Requirements", bundle.requirements()))
                .append(codeSection(bundle))
                .append(section("Test cases", bundle.tests()))
                .append(section("Documentation", bundle.documentation()));
        for (StageName stage : List.of(StageName.REQUIREMENTS, StageName.CODE, StageName.TESTS,
                StageName.DOCUMENTATION, StageName.SECURITY, StageName.BUG_SYNTHESIS)) {
            if (stage == StageName.SECURITY && !bundle.securityEnabled()) {
                continue;
            }
            prompt.append(stageSection(ctx, stage));
        }
        if (!bundle.securityEnabled()) {
            prompt.append("Security analysis was not requested: leave security_vulnerabilities empty.\n");
        }
        return prompt.toString();
    }

    private static String section(String title, String body) {
        String content = body == null || body.isBlank() ? "(not provided)" : body.strip();
        return "## " + title + "\n" + content + "\n\n";
    }

    private static String codeSection(AnalysisBundle bundle) {
        if (bundle.code().isBlank()) {
            return section("Source code", "");
        }
        return "## Source code\n```\n" + bundle.code().strip() + "\n```\n\n";
    }

    private static String stageSection(StageContext ctx, StageName stage) {
        return "## Result of the " + stage + " analysis\n" + ctx.render(stage) + "\n\n";
    }
}
