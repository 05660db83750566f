package com.codegraph.builder;

import com.codegraph.builder.identity.NodeIds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdsTest {

    @Test
    void declarationIdIsFirst64BitsOfSha256() {
        assertEquals("1bb58da64b5550bc", NodeIds.forDeclaration("src/user.ts:getUserById", "(string)->User"));
    }

    @Test
    void sameInputsGiveSameId() {
        String a = NodeIds.forDeclaration("src/a.ts:foo", "()->void");
        String b = NodeIds.forDeclaration("src/a.ts:foo", "()->void");
        assertEquals(a, b);
        assertTrue(a.matches("[0-9a-f]{16}"), "Expected 16 lower-case hex chars: " + a);
    }

    @Test
    void signatureChangesId() {
        assertNotEquals(
            NodeIds.forDeclaration("src/a.ts:foo", "()->void"),
            NodeIds.forDeclaration("src/a.ts:foo", "(x)->void"));
    }

    @Test
    void fileIdIsDomainSeparated() {
        assertEquals("008af3075447a2b9", NodeIds.forFile("src/user.ts"));
        assertEquals("a6527f7775e13a5b", NodeIds.forDeclaration("src/user.ts", ""));
        assertNotEquals(NodeIds.forFile("src/user.ts"), NodeIds.forDeclaration("src/user.ts", ""));
    }

    @Test
    void nullInputsHashAsEmpty() {
        assertEquals(NodeIds.forDeclaration("", ""), NodeIds.forDeclaration(null, null));
    }
}
