package io.lighting.mongosql.sql.compile;

import static io.lighting.mongosql.sql.compile.CompilerFixtures.compile;
import static io.lighting.mongosql.sql.compile.CompilerFixtures.pipeline;
import static io.lighting.mongosql.sql.compile.CompilerFixtures.stages;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.mongosql.command.CommandKind;
import io.lighting.mongosql.command.SelectCommand;
import io.lighting.mongosql.error.UnresolvedTableException;
import io.lighting.mongosql.error.UnsupportedFeatureException;
import io.lighting.mongosql.sql.Bindings;
import java.util.Arrays;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestReporter;

class SelectLoweringTest {

    @Test
    void selectAllWithFilterSortAndLimit() {
        SelectCommand command = assertInstanceOf(
            SelectCommand.class,
            compile("SELECT * FROM users WHERE age > 25 ORDER BY name ASC LIMIT 10")
        );
        assertEquals(CommandKind.SELECT, command.kind());
        assertEquals("users", command.collection());
        assertEquals(
            stages("{$match: {age: {$gt: 25}}}", "{$sort: {name: 1}}", "{$limit: 10}"),
            command.pipeline()
        );
    }

    @Test
    void projectsSelectedColumns() {
        assertEquals(
            stages(
                "{$match: {city: {$eq: 'New York'}}}",
                "{$project: {name: '$name', age: '$age', _id: 0}}"
            ),
            pipeline("SELECT name, age FROM users WHERE city = 'New York'")
        );
    }

    @Test
    void keepsIdWhenSelected() {
        assertEquals(
            stages("{$project: {_id: '$_id', name: '$name'}}"),
            pipeline("SELECT _id, name FROM users")
        );
    }

    @Test
    void groupsJoinedRowsWithHaving(TestReporter reporter) {
        SelectCommand command = (SelectCommand) compile(
            "SELECT u.name, COUNT(o._id) AS orders FROM users u LEFT JOIN orders o ON o.userId = u._id "
                + "GROUP BY u.name HAVING COUNT(o._id) > 3"
        );
        reporter.publishEntry("pipeline", command.toJson());
        assertEquals(
            stages(
                "{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'o'}}",
                "{$unwind: {path: '$o', preserveNullAndEmptyArrays: true}}",
                "{$group: {_id: {name: '$name'}, orders: {$sum: {$cond: [{$gt: ['$o._id', null]}, 1, 0]}}}}",
                "{$match: {orders: {$gt: 3}}}",
                "{$project: {name: '$_id.name', orders: 1, _id: 0}}"
            ),
            command.pipeline()
        );
    }

    @Test
    void innerJoinDropsUnmatchedRows() {
        List<Document> pipeline = pipeline(
            "SELECT u.name, o.total FROM users u JOIN orders o ON u._id = o.userId WHERE u.active = true"
        );
        assertEquals(
            stages(
                "{$match: {active: {$eq: true}}}",
                "{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'o'}}",
                "{$unwind: {path: '$o', preserveNullAndEmptyArrays: false}}",
                "{$project: {name: '$name', total: '$o.total', _id: 0}}"
            ),
            pipeline
        );
    }

    @Test
    void filterOnJoinedTableIsRejected() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT * FROM users u JOIN orders o ON o.userId = u._id WHERE o.total > 5")
        );
    }

    @Test
    void unknownQualifierIsUnresolved() {
        UnresolvedTableException error = assertThrows(
            UnresolvedTableException.class,
            () -> compile("SELECT x.name FROM users u")
        );
        assertEquals("x", error.tableName());
        assertThrows(UnresolvedTableException.class, () -> compile("SELECT * FROM ghosts"));
    }

    @Test
    void countStarAndCountFieldDiffer() {
        assertEquals(
            stages(
                "{$group: {_id: null, total: {$sum: 1}, withEmail: {$sum: {$cond: [{$gt: ['$email', null]}, 1, 0]}}}}",
                "{$project: {total: 1, withEmail: 1, _id: 0}}"
            ),
            pipeline("SELECT COUNT(*) AS total, COUNT(email) AS withEmail FROM users")
        );
    }

    @Test
    void aggregatesWithoutAliasUseLowerCaseFunctionName() {
        assertEquals(
            stages(
                "{$group: {_id: {city: '$city'}, sum: {$sum: '$age'}, avg: {$avg: '$age'}, min: {$min: '$age'}, max: {$max: '$age'}}}",
                "{$project: {city: '$_id.city', sum: 1, avg: 1, min: 1, max: 1, _id: 0}}"
            ),
            pipeline("SELECT city, SUM(age), AVG(age), MIN(age), MAX(age) FROM users GROUP BY city")
        );
    }

    @Test
    void groupKeyTakesSelectAlias() {
        assertEquals(
            stages(
                "{$group: {_id: {town: '$city'}, n: {$sum: 1}}}",
                "{$match: {'_id.town': {$eq: 'Oslo'}}}",
                "{$project: {town: '$_id.town', n: 1, _id: 0}}",
                "{$sort: {n: -1}}"
            ),
            pipeline(
                "SELECT city AS town, COUNT(*) AS n FROM users GROUP BY city HAVING city = 'Oslo' ORDER BY n DESC"
            )
        );
    }

    @Test
    void havingMayReferenceAggregateAlias() {
        List<Document> pipeline = pipeline("SELECT city, COUNT(*) AS n FROM users GROUP BY city HAVING n >= 2");
        assertEquals(Document.parse("{$match: {n: {$gte: 2}}}"), pipeline.get(1));
    }

    @Test
    void havingRejectsUnselectedAggregate() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city, COUNT(*) AS n FROM users GROUP BY city HAVING SUM(age) > 10")
        );
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city, COUNT(*) AS n FROM users GROUP BY city HAVING age > 10")
        );
    }

    @Test
    void havingWithoutGroupingIsRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT name FROM users HAVING name = 'a'"));
    }

    @Test
    void nonGroupedColumnIsRejected() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city, name, COUNT(*) FROM users GROUP BY city")
        );
    }

    @Test
    void aggregateOutsideSelectListIsRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT COUNT(*) + 1 AS n FROM users"));
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT * FROM users WHERE COUNT(*) > 1"));
    }

    @Test
    void projectsExpressionsAndFunctions() {
        assertEquals(
            stages(
                "{$project: {"
                    + "label: {$toUpper: '$name'}, "
                    + "gross: {$add: ['$price', {$multiply: ['$price', 0.2]}]}, "
                    + "neg: {$multiply: ['$price', -1]}, "
                    + "nick: {$ifNull: ['$nick', '$name']}, "
                    + "_id: 0}}"
            ),
            pipeline(
                "SELECT UPPER(name) AS label, price + price * 0.2 AS gross, -price AS neg, COALESCE(nick, name) AS nick "
                    + "FROM products"
            )
        );
    }

    @Test
    void wrapsProjectedConstantsInLiteral() {
        List<Document> pipeline = ((SelectCommand) compile(
            "SELECT 1 AS one, 'x' AS tag, :price AS price, CONCAT('$', name) AS label FROM products",
            Bindings.of("price", "$9")
        )).pipeline();
        Document project = new Document("one", new Document("$literal", 1))
            .append("tag", new Document("$literal", "x"))
            .append("price", new Document("$literal", "$9"))
            .append("label", new Document("$concat", Arrays.asList(new Document("$literal", "$"), "$name")))
            .append("_id", 0);
        assertEquals(List.of(new Document("$project", project)), pipeline);
    }

    @Test
    void defaultOutputNames() {
        Document project = pipeline("SELECT lower(name), price * 2 FROM products").get(0).get("$project", Document.class);
        assertEquals(List.of("lower", "expr2", "_id"), List.copyOf(project.keySet()));
    }

    @Test
    void unknownFunctionIsRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT SOUNDEX(name) FROM users"));
    }

    @Test
    void wildcardMixedWithColumnsIsRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT *, name FROM users"));
    }

    @Test
    void duplicateOutputNamesAreRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT name, age AS name FROM users"));
    }

    @Test
    void sortsByAliasAndSelectedExpression() {
        List<Document> pipeline = pipeline(
            "SELECT name AS n, UPPER(city) AS c FROM users ORDER BY n DESC, UPPER(city) LIMIT 2 OFFSET 5"
        );
        assertEquals(
            stages("{$sort: {n: -1, c: 1}}", "{$skip: 5}", "{$limit: 2}"),
            pipeline.subList(1, 4)
        );
    }

    @Test
    void sortByDroppedColumnIsRejected() {
        assertThrows(UnsupportedFeatureException.class, () -> compile("SELECT name FROM users ORDER BY age"));
    }

    @Test
    void sortWithoutProjectionUsesDocumentPath() {
        assertEquals(
            stages(
                "{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'o'}}",
                "{$unwind: {path: '$o', preserveNullAndEmptyArrays: true}}",
                "{$sort: {'o.total': -1}}"
            ),
            pipeline("SELECT * FROM users u LEFT JOIN orders o ON o.userId = u._id ORDER BY o.total DESC")
        );
    }

    @Test
    void appliesFieldMapEverywhere() {
        List<Document> pipeline = pipeline(
            "SELECT customerId, fullName FROM customers c WHERE c.fullName LIKE 'A%' ORDER BY fullName"
        );
        Document match = new Document("$match", new Document(
            "name",
            new Document("$regex", "^A.*$").append("$options", "i")
        ));
        assertEquals(match, pipeline.get(0));
        assertEquals(Document.parse("{$project: {customerId: '$_id', fullName: '$name', _id: 0}}"), pipeline.get(1));
        assertEquals(Document.parse("{$sort: {fullName: 1}}"), pipeline.get(2));
        assertEquals("crm_customers", ((SelectCommand) compile("SELECT * FROM customers")).collection());
    }

    @Test
    void joinedCollectionUsesItsFieldMap() {
        List<Document> pipeline = pipeline(
            "SELECT o.total FROM orders o JOIN customers c ON c.customerId = o.customerId"
        );
        assertEquals(
            Document.parse("{$lookup: {from: 'crm_customers', localField: 'customerId', foreignField: '_id', as: 'c'}}"),
            pipeline.get(0)
        );
    }

    @Test
    void joinMustReferenceJoinedAlias() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT * FROM users u JOIN orders o ON u._id = u.ownerId")
        );
    }

    @Test
    void unqualifiedJoinConditionReadsLeftAsPrimary() {
        assertEquals(
            stages(
                "{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'orders'}}",
                "{$unwind: {path: '$orders', preserveNullAndEmptyArrays: false}}"
            ),
            pipeline("SELECT * FROM users JOIN orders ON _id = userId")
        );
        assertEquals(
            Document.parse("{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'o'}}"),
            pipeline("SELECT * FROM users u JOIN orders o ON u._id = userId").get(0)
        );
    }

    @Test
    void groupKeysSharingAColumnNameAreQualified() {
        assertEquals(
            stages(
                "{$lookup: {from: 'orders', localField: '_id', foreignField: 'userId', as: 'o'}}",
                "{$unwind: {path: '$o', preserveNullAndEmptyArrays: false}}",
                "{$group: {_id: {u_name: '$name', o_name: '$o.name'}, n: {$sum: 1}}}",
                "{$project: {n: 1, u_name: '$_id.u_name', o_name: '$_id.o_name', _id: 0}}"
            ),
            pipeline("SELECT COUNT(*) AS n FROM users u JOIN orders o ON o.userId = u._id GROUP BY u.name, o.name")
        );
    }

    @Test
    void clashingGroupKeyNamesAreRejected() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city AS k, o.city AS k FROM users u JOIN orders o ON o.userId = u._id "
                + "GROUP BY u.city, o.city")
        );
    }

    @Test
    void aggregateCannotReuseGroupKeyName() {
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city, COUNT(*) AS _id FROM users GROUP BY city")
        );
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT COUNT(*) AS city FROM users GROUP BY city")
        );
        assertThrows(
            UnsupportedFeatureException.class,
            () -> compile("SELECT city AS town, COUNT(*) AS town FROM users GROUP BY city")
        );
    }

    @Test
    void unselectedGroupKeysAreStillProjected() {
        assertEquals(
            stages(
                "{$group: {_id: {city: '$city', age: '$age'}, n: {$sum: 1}}}",
                "{$project: {n: 1, city: '$_id.city', age: '$_id.age', _id: 0}}"
            ),
            pipeline("SELECT COUNT(*) AS n FROM users GROUP BY city, age")
        );
    }

    @Test
    void groupKeyMayBeSelectedAsId() {
        assertEquals(
            stages(
                "{$group: {_id: {_id: '$city'}, n: {$sum: 1}}}",
                "{$project: {_id: '$_id._id', n: 1}}"
            ),
            pipeline("SELECT city AS _id, COUNT(*) AS n FROM users GROUP BY city")
        );
    }

    @Test
    void stageOrderIsFixed() {
        List<Document> pipeline = pipeline(
            "SELECT u.city, COUNT(*) AS n FROM users u JOIN orders o ON o.userId = u._id WHERE u.age > 1 "
                + "GROUP BY u.city HAVING COUNT(*) > 1 ORDER BY n LIMIT 3 OFFSET 1"
        );
        List<String> operators = pipeline.stream().map(stage -> stage.keySet().iterator().next()).toList();
        assertEquals(
            List.of("$match", "$lookup", "$unwind", "$group", "$match", "$project", "$sort", "$skip", "$limit"),
            operators
        );
        assertTrue(pipeline.get(3).get("$group", Document.class).containsKey("n"));
    }
}
