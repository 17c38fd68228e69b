package org.morkdb.builder;

import org.morkdb.model.DictionaryStore;
import org.morkdb.model.MorkLookupException;
import org.morkdb.model.ObjectKey;
import org.morkdb.syntax.CellNode;
import org.morkdb.syntax.CellText;
import org.morkdb.syntax.ObjectId;
import org.morkdb.syntax.ObjectRef;
import org.morkdb.syntax.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reference resolution")
class ReferenceResolverTest {

    private DictionaryStore dictionaries;
    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        dictionaries = new DictionaryStore();
        dictionaries.merge("c", Map.of("5", "history", "B8", "subject"));
        dictionaries.merge("a", Map.of("91", "Hello World", "B8", "value-side"));
        dictionaries.merge("m", Map.of("91", "from m"));
        resolver = new ReferenceResolver(dictionaries);
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        void unscopedIdentifierHasNoNamespace() {
            assertEquals(Optional.empty(), resolver.resolveNamespace(new ObjectId("3")));
        }

        @Test
        void literalScopeIsTheNamespace() {
            assertEquals(Optional.of("m"), resolver.resolveNamespace(new ObjectId("3", new Scope.Named("m"))));
        }

        @Test
        void symbolicScopeResolvesThroughColumnDictionary() {
            ObjectId id = new ObjectId("3", ObjectRef.to("5"));
            assertEquals(Optional.of("history"), resolver.resolveNamespace(id));
        }

        @Test
        void symbolicScopeHonorsExplicitDictionary() {
            ObjectId id = new ObjectId("3", ObjectRef.to("91", "m"));
            assertEquals(Optional.of("from m"), resolver.resolveNamespace(id));
        }

        @Test
        void defaultNamespaceAppliesOnlyWithoutScope() {
            assertEquals(Optional.of(new ObjectKey("t", "3")), resolver.resolveKey(new ObjectId("3"), "t"));
            assertEquals(Optional.of(new ObjectKey("history", "3")),
                    resolver.resolveKey(new ObjectId("3", ObjectRef.to("5")), "t"));
            assertEquals(Optional.empty(), resolver.resolveKey(new ObjectId("3"), null));
        }

        @Test
        void undefinedSymbolicScopeFails() {
            ObjectId id = new ObjectId("3", ObjectRef.to("FF"));
            MorkLookupException e = assertThrows(MorkLookupException.class, () -> resolver.resolveNamespace(id));
            assertEquals("c", e.getNamespace());
            assertEquals("FF", e.getAlias());
        }
    }

    @Nested
    @DisplayName("Cells")
    class Cells {

        @Test
        void literalColumnAndValueAreDecoded() {
            CellNode cell = CellNode.literal("sub$6Aect", "a\\)b");
            assertEquals(new ReferenceResolver.ResolvedCell("subject", "a)b"), resolver.resolveCell(cell));
        }

        @Test
        void columnReferenceDefaultsToColumnDictionary() {
            CellNode cell = new CellNode(ObjectRef.to("B8"), new CellText.Literal("x"));
            assertEquals("subject", resolver.resolveCell(cell).column());
        }

        @Test
        void valueReferenceDefaultsToValueDictionary() {
            CellNode cell = new CellNode(ObjectRef.to("B8"), ObjectRef.to("B8"));
            ReferenceResolver.ResolvedCell resolved = resolver.resolveCell(cell);
            assertEquals("subject", resolved.column());
            assertEquals("value-side", resolved.value());
        }

        @Test
        void valueReferenceWithExplicitNamespace() {
            CellNode cell = new CellNode(new CellText.Literal("k"), ObjectRef.to("91", "m"));
            assertEquals("from m", resolver.resolveCell(cell).value());
        }

        @Test
        void seededAliasesResolveWithoutDefinitions() {
            CellNode cell = new CellNode(ObjectRef.to("41"), ObjectRef.to("28"));
            assertEquals(new ReferenceResolver.ResolvedCell("A", "("), resolver.resolveCell(cell));
        }

        @Test
        void referenceToUndefinedNamespaceFails() {
            CellNode cell = new CellNode(new CellText.Literal("k"), ObjectRef.to("91", "nowhere"));
            MorkLookupException e = assertThrows(MorkLookupException.class, () -> resolver.resolveCell(cell));
            assertEquals("nowhere", e.getNamespace());
        }
    }
}
