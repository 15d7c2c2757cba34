package io.topicvote.standalone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.ValueJson;
import io.topicvote.core.model.VotingContext;
import io.topicvote.core.spi.VariableContext;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The JSON input of one evaluation: a global context and the voter contexts.
 *
 * <pre>
 * { "global": { "score_candidate": 0.7 }, "voters": [ { "rank": 1, "score": 0.5 }, ... ] }
 * </pre>
 *
 * Both members are optional. The contexts are mutable and are updated in place by evaluation.
 */
public record ContextDocument(VotingContext global, List<VotingContext> voters) {

    static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    /**
     * @throws ContextDocumentException if the file cannot be read or is not a context document
     */
    public static ContextDocument read(Path path) {
        if (!Files.exists(path)) {
            throw new ContextDocumentException("Input file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ContextDocumentException("Failed to parse JSON input: " + path, e);
        }
    }

    /**
     * @throws ContextDocumentException if {@code json} is not a context document
     */
    public static ContextDocument parse(String json) {
        try {
            return fromJson(JSON_MAPPER.readTree(json));
        } catch (IOException e) {
            throw new ContextDocumentException("Failed to parse JSON input", e);
        }
    }

    static ContextDocument fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ContextDocumentException("Input must be a JSON object with 'global' and 'voters'");
        }
        try {
            VotingContext global = ValueJson.toContext(root.path("global"));
            JsonNode votersNode = root.path("voters");
            List<VotingContext> voters = new ArrayList<>();
            if (!votersNode.isMissingNode() && !votersNode.isNull()) {
                if (!votersNode.isArray()) {
                    throw new ContextDocumentException("'voters' must be an array of objects");
                }
                for (JsonNode voter : votersNode) {
                    voters.add(ValueJson.toContext(voter));
                }
            }
            return new ContextDocument(global, voters);
        } catch (ValueTypeException e) {
            throw new ContextDocumentException("Invalid context value: " + e.getMessage(), e);
        }
    }

    /** The output document: the result followed by the contexts as evaluation left them. */
    public static ObjectNode toJson(Value result, VariableContext global, List<? extends VariableContext> voters) {
        ObjectNode root = JSON_MAPPER.createObjectNode();
        root.set("result", ValueJson.toJson(result));
        root.set("global", ValueJson.toJson(global));
        ArrayNode voterArray = root.putArray("voters");
        voters.forEach(voter -> voterArray.add(ValueJson.toJson(voter)));
        return root;
    }
}
