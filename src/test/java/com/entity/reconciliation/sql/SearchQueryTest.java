package com.entity.reconciliation.sql;

import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.core.model.QueryProperty;
import com.entity.reconciliation.store.MalformedQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchQuery Tests")
class SearchQueryTest {

    @Nested
    @DisplayName("SQL construction")
    class SqlTests {

        @Test
        @DisplayName("Without constraints only the match expression is bound")
        void noConstraints() {
            SearchQuery q = SearchQuery.builder("\"douglas\"*").build();

            assertEquals(List.of("\"douglas\"*"), q.params());
            assertTrue(q.sql().contains("FROM recongo_entities_fts a\n"));
            assertTrue(q.sql().contains("WHERE recongo_entities_fts MATCH ?"));
            assertTrue(q.sql().endsWith("ORDER BY score"));
            assertFalse(q.sql().contains("recongo_entity_properties"));
        }

        @Test
        @DisplayName("Each constraint joins under the next alias, params in placeholder order")
        void twoConstraints() {
            SearchQuery q = SearchQuery.builder("\"douglas\"*")
                    .property("occupation", "writer")
                    .property("born", Map.of("id", "place:cambridge"))
                    .build();

            assertTrue(q.sql().contains("FROM recongo_entities_fts a, recongo_entity_properties b, recongo_entity_properties c"));
            assertTrue(q.sql().contains("AND b.prop_id = ? AND b.prop_value = ? AND a.ent_id = b.ent_id AND a.ent_types = b.ent_types"));
            assertTrue(q.sql().contains("AND c.prop_id = ? AND c.prop_value = ? AND a.ent_id = c.ent_id AND a.ent_types = c.ent_types"));
            assertEquals(List.of("\"douglas\"*", "occupation", "writer", "born", "cambridge"), q.params());
            assertEquals(q.params().size(), q.sql().chars().filter(ch -> ch == '?').count());
        }

        @Test
        @DisplayName("Values are never written into the SQL text")
        void noInterpolation() {
            SearchQuery q = SearchQuery.builder("\"x\"*").property("p", "'; DROP TABLE recongo_entities; --").build();

            assertFalse(q.sql().contains("DROP"));
            assertEquals("'; DROP TABLE recongo_entities; --", q.params().get(2));
        }

        @Test
        @DisplayName("Constraints beyond the last alias are rejected")
        void tooManyConstraints() {
            List<QueryProperty> constraints = new ArrayList<>();
            for (int i = 0; i < 26; i++) {
                constraints.add(new QueryProperty("p" + i, "v"));
            }
            SearchQuery.Builder builder = SearchQuery.builder("\"x\"*");

            assertThrows(MalformedQueryException.class, () -> builder.properties(constraints));
        }

        @Test
        @DisplayName("A blank match expression is a programming error")
        void blankMatchExpression() {
            assertThrows(IllegalArgumentException.class, () -> SearchQuery.builder(" "));
        }
    }

    @Nested
    @DisplayName("Constraint values")
    class ConstraintValueTests {

        @Test
        @DisplayName("Scalars should resolve to their stored text")
        void scalars() {
            assertEquals("writer", SearchQuery.constraintValue("p", "writer"));
            assertEquals("true", SearchQuery.constraintValue("p", true));
            assertEquals("1979", SearchQuery.constraintValue("p", 1979));
            assertEquals("1979", SearchQuery.constraintValue("p", new BigDecimal("1979")));
            assertEquals("2.5", SearchQuery.constraintValue("p", 2.5));
            assertEquals("2.5", SearchQuery.constraintValue("p", new BigDecimal("2.5")));
        }

        @Test
        @DisplayName("References should resolve to the raw key")
        void references() {
            assertEquals("cambridge", SearchQuery.constraintValue("p", Map.of("id", "place:cambridge")));
            assertEquals("cambridge", SearchQuery.constraintValue("p", Map.of("id", "cambridge", "name", "Cambridge")));
            assertEquals("cambridge",
                    SearchQuery.constraintValue("p", PropertyValue.ofReference("place:cambridge", "Cambridge")));
        }

        @Test
        @DisplayName("Uninterpretable values should be malformed")
        void malformed() {
            assertThrows(MalformedQueryException.class, () -> SearchQuery.constraintValue("p", null));
            assertThrows(MalformedQueryException.class, () -> SearchQuery.constraintValue("p", List.of("a")));
            assertThrows(MalformedQueryException.class, () -> SearchQuery.constraintValue("p", Map.of("name", "x")));
            assertThrows(MalformedQueryException.class,
                    () -> SearchQuery.builder("\"x\"*").property(" ", "v"));
        }
    }

    @Nested
    @DisplayName("Match expression")
    class MatchExpressionTests {

        @ParameterizedTest(name = "''{0}'' -> {1}")
        @CsvSource(delimiter = '|', value = {
                "Douglas|\"Douglas\"*",
                "Douglas Ad|\"Douglas\" \"Ad\"*",
                "Brien-Flann (writer)|\"Brien\" \"Flann\" \"writer\"*",
                "AND OR NOT|\"AND\" \"OR\" \"NOT\"*",
                "q42|\"q42\"*"
        })
        @DisplayName("Tokens are quoted, the last one matches as a prefix")
        void tokens(String text, String expected) {
            assertEquals(Optional.of(expected), SearchQuery.matchExpression(text));
        }

        @Test
        @DisplayName("Text without letters or digits has no expression")
        void noTokens() {
            assertEquals(Optional.empty(), SearchQuery.matchExpression(""));
            assertEquals(Optional.empty(), SearchQuery.matchExpression(" \"*()- "));
        }
    }
}
