package no.cantara.intent.verify.workspace;

import java.nio.file.Path;

/**
 * @param workRoot             directory that {@code rel_path} refs resolve against, or {@code null}
 *                             to check hash formats only
 * @param skipHashVerification do not read referenced files even when a work root is given
 */
public record WorkspaceVerifyOptions(Path workRoot, boolean skipHashVerification) {

    public static final WorkspaceVerifyOptions DEFAULTS = new WorkspaceVerifyOptions(null, false);

    public static WorkspaceVerifyOptions resolvingAgainst(Path workRoot) {
        return new WorkspaceVerifyOptions(workRoot, false);
    }
}
