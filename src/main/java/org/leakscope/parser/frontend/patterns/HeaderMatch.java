package org.leakscope.parser.frontend.patterns;

import org.leakscope.parser.api.IssueType;

/**
 * The raw fields of a recognized issue header. Count tokens are kept verbatim so that
 * normalization failures surface where the record is built.
 *
 * @param issueType The classified type; {@link IssueType#OTHER} for unknown verdicts.
 * @param knownVerdict Whether the verdict matched a known category keyword.
 * @param verdict The verdict text, e.g. {@code definitely lost} or {@code Invalid read of size 4}.
 * @param bytesToken The byte count token, including any parenthetical breakdown.
 * @param blocksToken The block count token.
 * @param lossRecordId The loss record reference, empty when absent.
 */
public record HeaderMatch(
        IssueType issueType,
        boolean knownVerdict,
        String verdict,
        String bytesToken,
        String blocksToken,
        String lossRecordId
) {
}
