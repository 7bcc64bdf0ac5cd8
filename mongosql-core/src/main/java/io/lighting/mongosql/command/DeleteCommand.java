package io.lighting.mongosql.command;

import java.util.Objects;
import org.bson.Document;

public record DeleteCommand(String collection, Document filter) implements CompiledCommand {
    public DeleteCommand {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(filter, "filter");
    }

    @Override
    public CommandKind kind() {
        return CommandKind.DELETE;
    }

    @Override
    public Document toDocument() {
        return new Document("delete", collection).append("filter", filter);
    }
}
