package io.mcoda.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.mcoda.util.Jsons;
import io.mcoda.util.StorageIoException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON-lines file per lane under the context directory. Appends add a line, replacements
 * rewrite the file through a temp sibling and rename.
 */
public final class FileContextStore implements ContextStore {
    private final Path dir;

    public FileContextStore(Path dir) {
        this.dir = dir;
    }

    public Path laneFile(String laneId) {
        StringBuilder safe = new StringBuilder(laneId.length());
        for (int i = 0; i < laneId.length(); i++) {
            char ch = laneId.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '-' || ch == '.';
            safe.append(ok ? ch : '_');
        }
        return dir.resolve(safe + ".jsonl");
    }

    @Override
    public List<LaneMessage> loadLane(String laneId) {
        Path file = laneFile(laneId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageIoException("Failed to read context lane: " + file, e);
        }
        List<LaneMessage> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.mapper().readValue(line, LaneMessage.class));
            } catch (JsonProcessingException e) {
                throw new StorageIoException("Corrupt context lane " + file + " at line " + lineNo, e);
            }
        }
        return out;
    }

    @Override
    public List<LaneMessage> append(String laneId, LaneMessage message) {
        Path file = laneFile(laneId);
        try {
            Files.createDirectories(dir);
            Files.writeString(file, Jsons.toCompactJson(message) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageIoException("Failed to append to context lane: " + file, e);
        }
        return loadLane(laneId);
    }

    @Override
    public List<LaneMessage> replace(String laneId, List<LaneMessage> messages) {
        StringBuilder content = new StringBuilder();
        for (LaneMessage message : messages) {
            content.append(Jsons.toCompactJson(message)).append('\n');
        }
        Jsons.writeStringAtomic(laneFile(laneId), content.toString());
        return List.copyOf(messages);
    }
}
