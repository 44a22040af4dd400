package com.eainde.patientqa.review;

import com.eainde.patientqa.evaluation.PairKey;
import com.eainde.patientqa.judge.Verdict;

/**
 * Final verdict for a pair after applying human reviews.
 *
 * @param pair         the (case, configuration) pair
 * @param judgeVerdict judge verdict, null when the pair was never judged
 * @param humanVerdict verdict of the most recent human review, null when unreviewed
 * @param reviewCount  number of human reviews retained
 */
public record ReconciledVerdict(PairKey pair, Verdict judgeVerdict, Verdict humanVerdict, int reviewCount) {

    /** Human verdict when one exists, otherwise the judge's. */
    public Verdict finalVerdict() {
        return humanVerdict != null ? humanVerdict : judgeVerdict;
    }

    /** The human disagreed with a scored judge verdict. */
    public boolean humanOverride() {
        return humanVerdict != null && judgeVerdict != null && judgeVerdict != Verdict.UNSCORED
                && humanVerdict != judgeVerdict;
    }
}
