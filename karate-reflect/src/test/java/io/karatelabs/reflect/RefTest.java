package io.karatelabs.reflect;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RefTest {

    @Test
    void testCell() {
        Ref<String> ref = Ref.of("a");
        assertEquals("a", ref.get());
        ref.set("b");
        assertEquals("b", ref.get());
        assertEquals(ValueType.STRING, ref.getType());
        assertNotEquals(Ref.of("b"), ref);
    }

    @Test
    void testEmptyCellHoldsZeroValue() {
        assertNull(Ref.empty(String.class).get());
        assertEquals(0, Ref.empty(int.class).get());
    }

    @Test
    void testCellRejectsWrongType() {
        ReflectException e = assertThrows(ReflectException.class, () -> Ref.of(ValueType.INTEGER, (Object) "x"));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void testFieldSlot() {
        DemoChild child = new DemoChild("a", 1);
        Field field = ValueType.of(DemoChild.class).getField("size");
        Ref<Object> ref = Refs.field(child, field);
        assertEquals(ValueType.of(long.class), ref.getType());
        ref.set(5L);
        assertEquals(5L, child.getSize());
        assertEquals(ref, Refs.field(child, field));
        assertNotEquals(ref, Refs.field(new DemoChild(), field));
        ReflectException e = assertThrows(ReflectException.class, () -> Refs.field(null, field));
        assertEquals(ErrorKind.NIL_POINTER, e.getKind());
    }

    @Test
    void testListAndArraySlots() {
        List<Object> list = new ArrayList<>(List.of("a", "b"));
        Ref<Object> element = Refs.listElement(list, 1, ValueType.STRING);
        element.set("c");
        assertEquals(List.of("a", "c"), list);
        assertEquals(element, Refs.listElement(list, 1, ValueType.STRING));
        int[] array = {1, 2};
        Ref<Object> slot = Refs.arrayElement(array, 0);
        assertEquals(ValueType.of(int.class), slot.getType());
        slot.set(9);
        assertEquals(9, array[0]);
    }

    @Test
    void testMapSlot() {
        Map<Object, Object> map = new HashMap<>();
        Ref<Object> entry = Refs.mapEntry(map, "k", ValueType.OBJECT);
        assertNull(entry.get());
        entry.set(1);
        assertEquals(1, map.get("k"));
        assertEquals(entry, Refs.mapEntry(map, "k", ValueType.OBJECT));
    }

}
