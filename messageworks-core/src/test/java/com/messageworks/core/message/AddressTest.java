package com.messageworks.core.message;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    void testRootAndChildren() {
        Address root = Address.root();
        assertTrue(root.isRoot());
        assertEquals(0, root.depth());
        assertEquals("/", root.toString());
        assertEquals(root, Address.parse("  //  "));

        Address child = root.child("a").child(" b ");
        assertEquals(List.of("a", "b"), child.getSegments());
        assertEquals("/a/b", child.toString());
        assertEquals("b", child.lastSegment());
        assertEquals(Address.of("a"), child.parent());
        assertEquals(root, root.parent());
        assertTrue(root.isAncestorOf(child));
        assertTrue(Address.of("a").isAncestorOf(child));
        assertFalse(child.isAncestorOf(child));
    }

    @Test
    @DisplayName("子上下文名称必须是单个分段")
    void testChildRejectsMultiSegmentName() {
        assertThrows(IllegalArgumentException.class, () -> Address.root().child("a/b"));
        assertThrows(IllegalArgumentException.class, () -> Address.root().child("  "));
        assertThrows(IllegalArgumentException.class, () -> Address.root().child(null));
    }

    @Test
    void testSegmentsAreImmutable() {
        Address address = Address.of("a", "b");
        assertThrows(UnsupportedOperationException.class, () -> address.getSegments().add("c"));
    }

    @Test
    @DisplayName("JSON 序列化为规范字符串，反序列化接受字符串或数组")
    void testJsonForm() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"/a/b\"", mapper.writeValueAsString(Address.of("a", "b")));
        assertEquals(Address.of("a", "b"), mapper.readValue("\"a//b/\"", Address.class));
        assertEquals(Address.of("a", "b"), mapper.readValue("[\" a \", \"b\"]", Address.class));
        assertEquals(Address.root(), mapper.readValue("\"/\"", Address.class));
    }
}
