package io.mcoda.context;

public record PrepareOptions(String systemPrompt, String bundle, String model) {
    public static PrepareOptions forModel(String model) {
        return new PrepareOptions(null, null, model);
    }
}
