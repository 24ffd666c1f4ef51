package fun.fengwk.readex.core.simplify;

import lombok.Builder;
import lombok.Data;

/**
 * Independently toggleable simplification stages. Disabling a stage a later one relies on is allowed
 * and may leave artifacts in the output.
 *
 * @author fengwk
 */
@Data
@Builder
public class SimplifyOptions {

    @Builder.Default
    private boolean addContentDigests = false;

    @Builder.Default
    private boolean addNodeIndexes = false;

    @Builder.Default
    private boolean removeBlacklist = true;

    @Builder.Default
    private boolean unwrapElements = true;

    @Builder.Default
    private boolean processSpecial = true;

    @Builder.Default
    private boolean consolidateText = true;

    @Builder.Default
    private boolean removeEmpty = true;

    @Builder.Default
    private boolean unnestParagraphs = true;

    @Builder.Default
    private boolean insertBreaks = true;

    @Builder.Default
    private boolean wrapBareText = true;

    public static SimplifyOptions defaults() {
        return SimplifyOptions.builder().build();
    }

}
