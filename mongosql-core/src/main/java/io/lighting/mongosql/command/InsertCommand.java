package io.lighting.mongosql.command;

import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Insert into {@code collection}, either literal {@code documents} or the output of
 * a {@code source} pipeline. Exactly one of the two is present.
 */
public record InsertCommand(String collection, List<Document> documents, SelectCommand source)
    implements CompiledCommand {

    public InsertCommand {
        Objects.requireNonNull(collection, "collection");
        if ((documents == null) == (source == null)) {
            throw new IllegalArgumentException("Insert needs either documents or a source pipeline");
        }
        if (documents != null) {
            documents = List.copyOf(documents);
        }
    }

    public static InsertCommand ofDocuments(String collection, List<Document> documents) {
        return new InsertCommand(collection, documents, null);
    }

    public static InsertCommand fromSelect(String collection, SelectCommand source) {
        return new InsertCommand(collection, null, source);
    }

    public boolean hasSource() {
        return source != null;
    }

    @Override
    public CommandKind kind() {
        return CommandKind.INSERT;
    }

    @Override
    public Document toDocument() {
        Document command = new Document("insert", collection);
        if (source != null) {
            return command.append("source", source.toDocument());
        }
        return command.append("documents", documents);
    }
}
