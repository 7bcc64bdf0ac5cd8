package io.lighting.mongosql.command;

import org.bson.Document;

/**
 * Result of compiling one statement, ready for an execution layer.
 */
public sealed interface CompiledCommand
    permits SelectCommand, InsertCommand, UpdateCommand, DeleteCommand, TransactionCommand {

    CommandKind kind();

    /**
     * Command-shaped view used for logging, e.g.
     * {@code {"aggregate": "users", "pipeline": [...]}}.
     */
    Document toDocument();

    default String toJson() {
        return toDocument().toJson();
    }
}
