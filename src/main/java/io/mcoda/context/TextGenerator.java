package io.mcoda.context;

import java.util.List;

/**
 * A chat completion provider. Inference itself lives outside this library.
 */
@FunctionalInterface
public interface TextGenerator {
    String generate(List<LaneMessage> messages, String model) throws Exception;
}
