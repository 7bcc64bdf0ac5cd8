package io.lighting.mongosql.command;

import io.lighting.mongosql.sql.ast.TransactionDirective;
import java.util.Objects;
import org.bson.Document;

/**
 * Session control. Executing it (starting, committing or aborting a session
 * transaction) is left to the caller.
 */
public record TransactionCommand(TransactionDirective directive) implements CompiledCommand {
    public TransactionCommand {
        Objects.requireNonNull(directive, "directive");
    }

    @Override
    public CommandKind kind() {
        return CommandKind.TRANSACTION;
    }

    @Override
    public Document toDocument() {
        return new Document("transaction", directive.name());
    }
}
