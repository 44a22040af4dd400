package com.eainde.patientqa.judge;

import com.eainde.patientqa.evaluation.EvaluationCase;
import com.eainde.patientqa.evaluation.ModelResponse;
import com.eainde.patientqa.pipeline.GenerationException;
import com.eainde.patientqa.pipeline.ProviderInvoker;
import com.eainde.patientqa.prompt.PromptPayload;
import com.eainde.patientqa.provider.GenerationOptions;
import com.eainde.patientqa.provider.LanguageModelProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores a response against the fixed rubric with a judging model at temperature 0.
 * Malformed output and judge provider failure both yield {@link Verdict#UNSCORED};
 * a case is never defaulted to a grade.
 */
@Slf4j
public class RubricJudge {

    private static final int RAW_EXCERPT = 300;

    private final LanguageModelProvider judgeProvider;
    private final ProviderInvoker invoker;
    private final JudgeOutputDecoder decoder;
    private final RubricSettings settings;

    public RubricJudge(LanguageModelProvider judgeProvider, ProviderInvoker invoker,
                       JudgeOutputDecoder decoder, RubricSettings settings) {
        this.judgeProvider = judgeProvider;
        this.invoker = invoker;
        this.decoder = decoder;
        this.settings = settings;
    }

    public JudgeScore score(EvaluationCase evaluationCase, ModelResponse response) {
        String caseId = evaluationCase.id();
        String configId = response.configId();
        if (response.isFailed()) {
            return JudgeScore.unscored(caseId, configId, "Response failed: " + response.failure(),
                    settings.rubricVersion());
        }

        PromptPayload prompt = PromptPayload.instruction(RubricPromptTemplate.SYSTEM,
                RubricPromptTemplate.render(evaluationCase, response.text(), settings.rubricVersion()));

        String raw;
        try {
            raw = invoker.invoke(judgeProvider, prompt, GenerationOptions.deterministic(settings.maxOutputTokens()));
        } catch (GenerationException e) {
            log.warn("Judge {} unavailable for {}/{}, marking UNSCORED", judgeProvider.id(), caseId, configId, e);
            return JudgeScore.unscored(caseId, configId, "Judge unavailable: " + e.getMessage(),
                    settings.rubricVersion());
        }

        try {
            JudgeScore score = decoder.decode(caseId, configId, raw);
            log.info("Judged {}/{}: {}% {}", caseId, configId, score.overallPercentage(), score.verdict());
            return score;
        } catch (JudgeParseException e) {
            log.warn("Unparseable judge output for {}/{}: {}", caseId, configId, e.getMessage());
            return JudgeScore.unscored(caseId, configId,
                    "Unparseable judge output: " + e.getMessage() + " | raw: " + excerpt(raw),
                    settings.rubricVersion());
        }
    }

    public String getJudgeId() {
        return judgeProvider.id();
    }

    private static String excerpt(String raw) {
        return raw.length() <= RAW_EXCERPT ? raw : raw.substring(0, RAW_EXCERPT) + "...";
    }
}
