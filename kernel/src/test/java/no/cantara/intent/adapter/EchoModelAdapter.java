package no.cantara.intent.adapter;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/** Answers every prompt with its upper-cased text. */
class EchoModelAdapter implements ModelAdapter {

    final AtomicInteger calls = new AtomicInteger();

    @Override
    public String adapterId() {
        return "echo_00000001";
    }

    @Override
    public String modelId() {
        return "echo";
    }

    @Override
    public TransformResult transform(String prompt, TransformContext context) {
        calls.incrementAndGet();
        return new TransformResult(prompt.toUpperCase(Locale.ROOT), prompt.length(), prompt.length(), 5,
                "echo-1", false);
    }
}
