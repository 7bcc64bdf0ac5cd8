package io.lighting.mongosql.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

public record SelectCommand(String collection, List<Document> pipeline) implements CompiledCommand {
    public SelectCommand {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(pipeline, "pipeline");
        pipeline = List.copyOf(pipeline);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.SELECT;
    }

    /**
     * The same pipeline with {@code stage} appended.
     */
    public SelectCommand withStage(Document stage) {
        Objects.requireNonNull(stage, "stage");
        List<Document> stages = new ArrayList<>(pipeline);
        stages.add(stage);
        return new SelectCommand(collection, stages);
    }

    @Override
    public Document toDocument() {
        return new Document("aggregate", collection).append("pipeline", pipeline);
    }
}
