package io.mcoda.context;

/**
 * Optional provenance for {@code append}. {@code role} is used only when the lane is created by
 * this call; {@code persisted} null means "persist when context storage is enabled".
 */
public record AppendMeta(String model, Integer tokens, LaneRole role, Boolean persisted) {
    public static AppendMeta none() {
        return new AppendMeta(null, null, null, null);
    }

    public static AppendMeta model(String model) {
        return new AppendMeta(model, null, null, null);
    }
}
