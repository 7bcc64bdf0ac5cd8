package io.lighting.mongosql.command;

import java.util.Objects;
import org.bson.Document;

/**
 * Multi-document update.
 *
 * @param filter      documents to update; empty matches all
 * @param assignments field to new value
 */
public record UpdateCommand(String collection, Document filter, Document assignments) implements CompiledCommand {
    public UpdateCommand {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(assignments, "assignments");
    }

    public Document update() {
        return new Document("$set", assignments);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.UPDATE;
    }

    @Override
    public Document toDocument() {
        return new Document("update", collection)
            .append("filter", filter)
            .append("update", update())
            .append("multi", true);
    }
}
