package no.cantara.intent;

import no.cantara.intent.canonical.ArtifactJson;
import no.cantara.intent.canonical.Canonicalizer;
import no.cantara.intent.decompose.DecompositionConfig;
import no.cantara.intent.model.Bundle;
import no.cantara.intent.model.Intent;
import no.cantara.intent.verify.VerificationResult;
import no.cantara.intent.verify.Values;
import no.cantara.intent.verify.apply.ApplyResultVerifier;
import no.cantara.intent.verify.apply.ApplyVerifyOptions;
import no.cantara.intent.verify.bundle.BundleSummarizer;
import no.cantara.intent.verify.bundle.BundleVerifier;
import no.cantara.intent.verify.modelio.ModelIoVerifier;
import no.cantara.intent.verify.patch.PatchVerifier;
import no.cantara.intent.verify.repostate.RepoStateVerifier;
import no.cantara.intent.verify.workspace.WorkspaceVerifier;
import no.cantara.intent.verify.workspace.WorkspaceVerifyOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command-line interface for the intent kernel.
 * <pre>
 * java -jar intent-kernel.jar transform &lt;intent.yaml&gt; [--config &lt;kernel.yaml&gt;]
 * java -jar intent-kernel.jar verify &lt;kind&gt; &lt;artifact.json&gt; [--patch &lt;patch.json&gt;]
 * java -jar intent-kernel.jar summarize &lt;bundle.json&gt;
 * </pre>
 * Exit codes: 0 success, 1 refused or invalid artifact, 2 usage or I/O error.
 */
public class IntentKernelCli {

    static final int OK = 0;
    static final int INVALID = 1;
    static final int USAGE = 2;

    static final List<String> KINDS = List.of("apply", "bundle", "model-io", "patch", "repo-state", "workspace");

    private static final String USAGE_TEXT = """
            Usage:
              intent-kernel transform <intent.yaml> [--config <kernel.yaml>]
              intent-kernel verify <kind> <artifact.json> [--patch <patch.json>]
              intent-kernel summarize <bundle.json>
            Kinds: apply, bundle, model-io, patch, repo-state, workspace""";

    private final PrintStream out;
    private final PrintStream err;

    IntentKernelCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new IntentKernelCli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        if (args.length < 2) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        try {
            return switch (args[0]) {
                case "transform" -> transform(args);
                case "verify" -> verify(args);
                case "summarize" -> summarize(args);
                default -> {
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE_TEXT);
                    yield USAGE;
                }
            };
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return USAGE;
        } catch (IllegalArgumentException e) {
            err.println("Parse error: " + e.getMessage());
            return USAGE;
        }
    }

    private int transform(String[] args) throws IOException {
        Path intentFile = existing(args[1]);
        if (intentFile == null) return USAGE;
        DecompositionConfig config = DecompositionConfig.DEFAULTS;
        String configArg = option(args, "--config");
        if (configArg != null) {
            Path configFile = existing(configArg);
            if (configFile == null) return USAGE;
            config = KernelConfigLoader.load(configFile);
        }

        Intent intent = IntentParser.parse(intentFile);
        KernelResult result = new IntentKernel(config).run(intent);
        if (result.bundle() == null) {
            err.println("Refused (" + result.refusal() + "): " + result.message());
            return INVALID;
        }
        Bundle bundle = result.bundle();
        out.println(Canonicalizer.canonicalize(bundle));
        err.printf("%s %s — %d node(s), %d output(s), %d unresolved question(s)%n",
                bundle.id(), result.kind(), bundle.stats().totalNodes(), bundle.stats().totalOutputs(),
                bundle.stats().unresolvedCount());
        result.questions().forEach(q -> err.println("  ? " + q.text()));
        return OK;
    }

    private int verify(String[] args) throws IOException {
        if (args.length < 3 || !KINDS.contains(args[1])) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        Path file = existing(args[2]);
        if (file == null) return USAGE;
        Object artifact = ArtifactJson.read(file);

        VerificationResult result = switch (args[1]) {
            case "bundle" -> new BundleVerifier().verify(artifact);
            case "model-io" -> new ModelIoVerifier().verify(artifact);
            case "repo-state" -> new RepoStateVerifier().verify(artifact);
            case "patch" -> new PatchVerifier().verify(artifact);
            case "workspace" -> new WorkspaceVerifier().verify(artifact,
                    WorkspaceVerifyOptions.resolvingAgainst(file.toAbsolutePath().getParent()));
            default -> verifyApply(artifact, option(args, "--patch"));
        };
        return report(file, result);
    }

    private VerificationResult verifyApply(Object artifact, String patchArg) throws IOException {
        ApplyResultVerifier verifier = new ApplyResultVerifier();
        if (patchArg == null) {
            return verifier.verify(artifact);
        }
        Map<String, Object> patch = Values.asObject(ArtifactJson.read(Path.of(patchArg)));
        if (patch == null) {
            throw new IllegalArgumentException("patch must be a JSON object: " + patchArg);
        }
        return verifier.verify(artifact, ApplyVerifyOptions.against(patch));
    }

    private int summarize(String[] args) throws IOException {
        Path file = existing(args[1]);
        if (file == null) return USAGE;
        Object artifact = ArtifactJson.read(file);
        VerificationResult result = new BundleVerifier().verify(artifact);
        if (!result.isValid()) {
            return report(file, result);
        }
        out.println(Canonicalizer.canonicalize(BundleSummarizer.summarize(Values.asObject(artifact))));
        return OK;
    }

    private int report(Path file, VerificationResult result) {
        if (!result.isValid()) {
            err.println("Verification failed — " + result.violations().size() + " violation(s) in " + file + ":");
            result.violations().forEach(v -> err.println("  • " + v));
            return INVALID;
        }
        out.println(result.contentHash());
        result.summary().forEach((k, v) -> err.println("  " + k + ": " + v));
        return OK;
    }

    private Path existing(String arg) {
        Path path = Path.of(arg);
        if (!Files.isRegularFile(path)) {
            err.println("Error: file not found: " + path);
            return null;
        }
        return path;
    }

    private static String option(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(name)) return args[i + 1];
        }
        return null;
    }
}
