package com.asiainfo.errortracking.domain.ast;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.asiainfo.errortracking.domain.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式树：结构相等、不可变、非法节点
 */
class AstTest {

    @Test
    void testStructuralEquality() {
        Expr a = compare(call("ifNull", field("properties", "$browser"), constant("x")), CompareOperation.Op.EQ, constant(1));
        Expr b = compare(call("ifNull", field("properties", "$browser"), constant("x")), CompareOperation.Op.EQ, constant(1));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, compare(field("x"), CompareOperation.Op.NOT_EQ, constant(1)));
    }

    @Test
    void testListsAreDefensivelyCopied() {
        List<Expr> args = new ArrayList<>(List.of(constant(1)));
        Call call = new Call("f", args);
        args.add(constant(2));

        assertEquals(1, call.args().size());
        assertThrows(UnsupportedOperationException.class, () -> call.args().add(constant(3)));
    }

    @Test
    void testConstantRejectsUnsupportedTypes() {
        assertDoesNotThrow(() -> constant(null));
        assertDoesNotThrow(() -> constant("s"));
        assertDoesNotThrow(() -> constant(42L));
        assertDoesNotThrow(() -> constant(true));
        assertDoesNotThrow(() -> constant(Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> constant(new Object()));
    }

    @Test
    void testInvalidNodes() {
        assertThrows(IllegalArgumentException.class, () -> new Field(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Tuple(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new And(List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> SelectQuery.builder().from(field("events")).build());
    }

    @Test
    void testFieldLast() {
        assertEquals("$browser", field("properties", "$browser").last());
        assertEquals("events", field("events").last());
    }

    @Test
    void testWithLimitKeepsEverythingElse() {
        SelectQuery query = SelectQuery.builder()
                .select(field("a"))
                .from(field("events"))
                .where(compare(field("a"), CompareOperation.Op.GT, constant(1)))
                .orderBy(desc(field("a")))
                .build();

        SelectQuery limited = query.withLimit(constant(10));

        assertNull(query.limit());
        assertEquals(constant(10), limited.limit());
        assertEquals(query.select(), limited.select());
        assertEquals(query.where(), limited.where());
        assertEquals(query.orderBy(), limited.orderBy());
    }
}
