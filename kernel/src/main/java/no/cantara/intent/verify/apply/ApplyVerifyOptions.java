package no.cantara.intent.verify.apply;

import java.util.Map;

/**
 * @param patch          the patch the result claims to apply, or {@code null} to skip AS6
 * @param skipPatchMatch skip AS6 even when a patch is given
 */
public record ApplyVerifyOptions(Map<String, Object> patch, boolean skipPatchMatch) {

    public static final ApplyVerifyOptions DEFAULTS = new ApplyVerifyOptions(null, false);

    public static ApplyVerifyOptions against(Map<String, Object> patch) {
        return new ApplyVerifyOptions(patch, false);
    }
}
