package io.mcoda.context;

public interface ContentRedactor {
    Redaction redact(String content);

    record Redaction(String content, int redactions) {
    }

    static ContentRedactor none() {
        return content -> new Redaction(content, 0);
    }
}
