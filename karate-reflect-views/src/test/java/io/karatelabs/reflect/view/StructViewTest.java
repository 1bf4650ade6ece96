package io.karatelabs.reflect.view;

import io.karatelabs.reflect.ErrorKind;
import io.karatelabs.reflect.Ref;
import io.karatelabs.reflect.ReflectException;
import io.karatelabs.reflect.Value;
import io.karatelabs.reflect.ValueType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StructViewTest {

    @Test
    void testOfRecordAndRef() {
        DemoPerson person = new DemoPerson("a", 1);
        assertSame(person, StructView.of(person).getValue());
        assertSame(person, StructView.of(Ref.of(person)).getValue());
        assertSame(person, StructView.of(Value.of(person)).getValue());
        assertEquals(ValueType.of(DemoPerson.class), StructView.of(person).getType());
    }

    @Test
    void testOfFailures() {
        ReflectException e = assertThrows(ReflectException.class, () -> StructView.of(5));
        assertEquals(ErrorKind.NOT_A_RECORD, e.getKind());
        e = assertThrows(ReflectException.class, () -> StructView.of(null));
        assertEquals(ErrorKind.NOT_A_RECORD, e.getKind());
        e = assertThrows(ReflectException.class, () -> StructView.of(Ref.empty(DemoPerson.class)));
        assertEquals(ErrorKind.NIL_POINTER, e.getKind());
        IllegalStateException ise = assertThrows(IllegalStateException.class, () -> StructView.mustOf("x"));
        assertInstanceOf(ReflectException.class, ise.getCause());
    }

    @Test
    void testNewInstance() {
        DemoPerson person = new DemoPerson("a", 1);
        Object created = StructView.of(person).newInstance().getValue();
        assertInstanceOf(DemoPerson.class, created);
        assertNotSame(person, created);
        assertEquals(new DemoPoint(0, 0), StructView.of(new DemoPoint(1, 2)).newInstance().getValue());
    }

    @Test
    void testFields() {
        StructView view = StructView.of(new DemoPerson("a", 1));
        assertEquals(List.of("name", "age", "address", "addressRef", "tags"), new ArrayList<>(view.fields().keySet()));
        assertTrue(view.hasField("age"));
        assertFalse(view.hasField("missing"));
        assertSame(Value.ABSENT, view.field("missing"));
        assertTrue(view.field("name").isAddressable());
        assertEquals("a", view.fieldValue("name"));
        assertNull(view.fieldValueOrNull("missing"));
        ReflectException e = assertThrows(ReflectException.class, () -> view.fieldValue("missing"));
        assertEquals(ErrorKind.UNKNOWN_FIELD, e.getKind());
    }

    @Test
    void testSetField() {
        DemoPerson person = new DemoPerson();
        StructView view = StructView.of(Ref.of(person));
        view.setField("name", "Bob");
        assertEquals("Bob", person.getName());
        view.setField("age", "42", true);
        assertEquals(42, person.getAge());
        ReflectException e = assertThrows(ReflectException.class, () -> view.setField("age", "x"));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
        e = assertThrows(ReflectException.class, () -> view.setField("missing", 1));
        assertEquals(ErrorKind.UNKNOWN_FIELD, e.getKind());
    }

    @Test
    void testFieldWriteThrough() {
        DemoPerson person = new DemoPerson("a", 1);
        StructView.of(person).field("age").set(2);
        assertEquals(2, person.getAge());
    }

    @Test
    void testRecordFieldsAreReadOnly() {
        StructView view = StructView.of(new DemoPoint(1, 2));
        assertEquals(2, (int) view.fieldValue("y"));
        ReflectException e = assertThrows(ReflectException.class, () -> view.setField("x", 5));
        assertEquals(ErrorKind.UNSETTABLE, e.getKind());
    }

    @Test
    void testToMapKeepsZeroFieldsAsNull() {
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("name", "a");
        expected.put("age", null);
        expected.put("address", null);
        expected.put("addressRef", null);
        expected.put("tags", null);
        assertEquals(expected, StructView.of(new DemoPerson("a", 0)).toMap(false, false));
    }

    @Test
    void testToMapNestsRecords() {
        DemoPerson person = new DemoPerson("a", 0);
        person.setAddress(new DemoAddress("Paris", 75000));
        person.setAddressRef(Ref.of(new DemoAddress("Lyon", 0)));
        person.setTags(new ArrayList<>());
        Map<String, Object> map = StructView.of(person).toMap(true, true);
        assertEquals(Map.of(
                "name", "a",
                "address", Map.of("city", "Paris", "zip", 75000),
                "addressRef", Map.of("city", "Lyon")), map);
    }

    @Test
    void testToMapOmitEmptyOnly() {
        DemoPerson person = new DemoPerson("a", 3);
        person.setTags(new ArrayList<>());
        Map<String, Object> map = StructView.of(person).toMap(false, true);
        // zero values count as empty
        assertEquals(Map.of("name", "a", "age", 3), map);
    }

    @Test
    void testFromMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "Zed");
        data.put("age", 30.0);
        data.put("address", Map.of("city", "Rome"));
        data.put("addressRef", Map.of("zip", 100));
        data.put("unknown", 1);
        data.put("tags", null);
        DemoPerson person = new DemoPerson();
        StructView.of(person).fromMap(data, true);
        assertEquals("Zed", person.getName());
        assertEquals(30, person.getAge());
        assertEquals("Rome", person.getAddress().getCity());
        assertEquals(100, person.getAddressRef().get().getZip());
        assertNull(person.getTags());
    }

    @Test
    void testFromMapFillsExistingNestedRecord() {
        DemoPerson person = new DemoPerson();
        DemoAddress address = new DemoAddress("Paris", 1);
        person.setAddress(address);
        StructView.of(person).fromMap(Map.of("address", Map.of("zip", 2)));
        assertSame(address, person.getAddress());
        assertEquals(2, address.getZip());
        assertEquals("Paris", address.getCity());
    }

    @Test
    void testFromMapSkipsZeroValues() {
        DemoPerson person = new DemoPerson("a", 5);
        StructView.of(person).fromMap(Map.of("name", "", "age", 0));
        assertEquals("a", person.getName());
        assertEquals(5, person.getAge());
    }

    @Test
    void testFromMapFailureNamesField() {
        DemoPerson person = new DemoPerson();
        StructView view = StructView.of(person);
        ReflectException e = assertThrows(ReflectException.class, () -> view.fromMap(Map.of("age", "x")));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
        assertTrue(e.getMessage().startsWith("type_mismatch: field age: "));
        e = assertThrows(ReflectException.class, () -> view.fromMap(Map.of("age", "x"), true));
        assertEquals(ErrorKind.UNCONVERTIBLE, e.getKind());
        assertTrue(e.getDetail().startsWith("field age: "));
        e = assertThrows(ReflectException.class, () -> view.fromMap(Map.of("address", Map.of("zip", "x"))));
        assertTrue(e.getDetail().startsWith("field address: field zip: "));
    }

}
