package io.karatelabs.reflect.view;

import io.karatelabs.reflect.ErrorKind;
import io.karatelabs.reflect.Kind;
import io.karatelabs.reflect.Ref;
import io.karatelabs.reflect.ReflectException;
import io.karatelabs.reflect.Value;
import io.karatelabs.reflect.ValueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SequenceViewTest {

    static List<String> names(List<DemoPerson> persons) {
        return persons.stream().map(DemoPerson::getName).collect(Collectors.toList());
    }

    static List<DemoPerson> persons() {
        return new ArrayList<>(List.of(new DemoPerson("c", 30), new DemoPerson("b", 20), new DemoPerson("d", 40)));
    }

    @Test
    void testOfList() {
        List<String> list = new ArrayList<>(List.of("a", "b"));
        SequenceView view = SequenceView.of(list);
        assertEquals(2, view.len());
        assertEquals(ValueType.OBJECT, view.getElementType());
        assertEquals("a", view.indexValue(0));
        assertSame(Value.ABSENT, view.index(2));
        assertSame(Value.ABSENT, view.index(-1));
        assertNull(view.indexValue(5));
        assertSame(list, view.getValue());
    }

    @Test
    void testOfTypedList() {
        List<String> list = new ArrayList<>(List.of("a", "b"));
        SequenceView view = SequenceView.of(Value.of(list, ValueType.listOf(String.class)));
        assertEquals(ValueType.STRING, view.getElementType());
        view.setIndexValue(0, "z");
        assertEquals("z", list.get(0));
        ReflectException e = assertThrows(ReflectException.class, () -> view.setIndexValue(0, 5));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
        e = assertThrows(ReflectException.class, () -> view.setIndexValue(2, "x"));
        assertEquals(ErrorKind.INDEX_OUT_OF_BOUNDS, e.getKind());
        view.setIndex(1, Value.of("y"));
        assertEquals(List.of("z", "y"), list);
    }

    @Test
    void testOfArray() {
        int[] array = {3, 1, 2};
        SequenceView view = SequenceView.of(array);
        assertEquals(3, view.len());
        assertEquals(ValueType.of(int.class), view.getElementType());
        assertEquals(3, (int) view.indexValue(0));
        view.setIndexValue(0, 9);
        assertEquals(9, array[0]);
        view.swap(0, 2);
        assertArrayEquals(new int[]{2, 1, 9}, array);
        ReflectException e = assertThrows(ReflectException.class, () -> view.swap(0, 3));
        assertEquals(ErrorKind.INDEX_OUT_OF_BOUNDS, e.getKind());
    }

    @Test
    void testSwapOnReadOnlyList() {
        ReflectException e = assertThrows(ReflectException.class, () -> SequenceView.of(List.of(1, 2)).swap(0, 1));
        assertEquals(ErrorKind.UNSETTABLE, e.getKind());
    }

    @Test
    void testRefToNullListIsInitialized() {
        Ref<List<String>> ref = Ref.of(ValueType.listOf(String.class), null);
        SequenceView view = SequenceView.of(ref);
        assertNotNull(ref.get());
        assertEquals(0, view.len());
        view.appendValues("a");
        assertEquals(List.of("a"), ref.get());
    }

    @Test
    void testOfFailures() {
        ReflectException e = assertThrows(ReflectException.class, () -> SequenceView.of(5));
        assertEquals(ErrorKind.NOT_A_SEQUENCE, e.getKind());
        e = assertThrows(ReflectException.class, () -> SequenceView.of(Ref.of(5)));
        assertEquals(ErrorKind.NOT_A_SEQUENCE, e.getKind());
        e = assertThrows(ReflectException.class, () -> SequenceView.of(null));
        assertEquals(ErrorKind.INVALID_VALUE, e.getKind());
        e = assertThrows(ReflectException.class,
                () -> SequenceView.of(Value.of(null, ValueType.refOf(ValueType.listOf(String.class)))));
        assertEquals(ErrorKind.NIL_POINTER, e.getKind());
        e = assertThrows(ReflectException.class, () -> SequenceView.of(Value.of(null, List.class)));
        assertEquals(ErrorKind.NIL_POINTER, e.getKind());
        IllegalStateException ise = assertThrows(IllegalStateException.class, () -> SequenceView.mustOf("x"));
        assertInstanceOf(ReflectException.class, ise.getCause());
    }

    @Test
    void testItemsAreDereferenced() {
        List<Object> list = new ArrayList<>(List.of(1, "a"));
        List<Value> items = SequenceView.of(list).items();
        assertEquals(2, items.size());
        assertEquals(Kind.INT, items.get(0).getKind());
        assertTrue(items.get(1).isString());
    }

    @Test
    void testAppendToTypedList() {
        List<String> list = new ArrayList<>(List.of("a"));
        SequenceView view = SequenceView.of(Value.of(list, ValueType.listOf(String.class)));
        view.appendValues("b", "c");
        assertEquals(List.of("a", "b", "c"), list);
        ReflectException e = assertThrows(ReflectException.class, () -> view.appendValues("d", 5));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
        assertEquals(3, list.size());
        e = assertThrows(ReflectException.class, () -> view.append(Value.ABSENT));
        assertEquals(ErrorKind.INVALID_VALUE, e.getKind());
    }

    @Test
    void testAppendToArrayNeedsLocation() {
        ReflectException e = assertThrows(ReflectException.class, () -> SequenceView.of(new int[]{1}).appendValues(2));
        assertEquals(ErrorKind.CANNOT_APPEND_TO_NON_REFERENCE, e.getKind());
    }

    @Test
    void testAppendToArrayThroughRef() {
        Ref<int[]> ref = Ref.of(new int[]{1, 2});
        SequenceView view = SequenceView.of(ref);
        view.appendValues(3);
        assertArrayEquals(new int[]{1, 2, 3}, ref.get());
        assertEquals(3, view.len());
    }

    @Test
    void testAppendToReadOnlyList() {
        ReflectException e = assertThrows(ReflectException.class, () -> SequenceView.of(List.of(1, 2)).appendValues(3));
        assertEquals(ErrorKind.UNSETTABLE, e.getKind());
    }

    @Test
    void testEmpty() {
        SequenceView view = SequenceView.empty(ValueType.of(int.class));
        assertEquals(0, view.len());
        view.appendValues(1, 2);
        Object result = view.getValue();
        assertEquals(List.of(1, 2), result);
        assertEquals(ValueType.INTEGER, view.newEmpty().getElementType());
    }

    @Test
    void testConvertToType() {
        SequenceView view = SequenceView.of(List.of(1, 2));
        Object strings = view.convertToType(ValueType.STRING).getValue();
        assertEquals(List.of("1", "2"), strings);
        Object longs = view.convertTo(0L).getValue();
        assertEquals(List.of(1L, 2L), longs);
        ReflectException e = assertThrows(ReflectException.class, () -> view.convertTo(null));
        assertEquals(ErrorKind.INVALID_VALUE, e.getKind());
    }

    @Test
    void testConvertElementFailure() {
        ReflectException e = assertThrows(ReflectException.class,
                () -> SequenceView.of(List.of("a")).convertToType(ValueType.INTEGER));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void testFilterBy() {
        SequenceView even = SequenceView.of(List.of(1, 2, 3, 4)).filterBy(v -> v.<Integer>getValue() % 2 == 0);
        Object result = even.getValue();
        assertEquals(List.of(2, 4), result);
        SequenceView fromArray = SequenceView.of(new int[]{1, 2, 3}).filterBy(v -> v.<Integer>getValue() > 1);
        result = fromArray.getValue();
        assertEquals(List.of(2, 3), result);
    }

    @Test
    void testSortBy() {
        List<Integer> list = new ArrayList<>(List.of(3, 1, 2));
        SequenceView.of(list).sortBy((a, b) -> a.<Integer>getValue() < b.<Integer>getValue());
        assertEquals(List.of(1, 2, 3), list);
        String[] array = {"b", "c", "a"};
        SequenceView.of(array).sortBy((a, b) -> a.<String>getValue().compareTo(b.getValue()) < 0);
        assertArrayEquals(new String[]{"a", "b", "c"}, array);
    }

    @Test
    void testSortByFailureLeavesSequenceUnchanged() {
        List<Integer> list = new ArrayList<>(List.of(3, 1, 2));
        assertThrows(IllegalStateException.class, () -> SequenceView.of(list).sortBy((a, b) -> {
            if (a.<Integer>getValue() == 2 || b.<Integer>getValue() == 2) {
                throw new IllegalStateException("no twos");
            }
            return a.<Integer>getValue() < b.<Integer>getValue();
        }));
        assertEquals(List.of(3, 1, 2), list);
    }

    @ParameterizedTest
    @CsvSource({"age,true,b c d", "age,false,d c b", "name,true,b c d", "name,false,d c b"})
    void testSortByField(String field, boolean ascending, String expected) {
        List<DemoPerson> persons = persons();
        SequenceView.of(persons).sortByField(field, ascending);
        assertEquals(Arrays.asList(expected.split(" ")), names(persons));
    }

    @Test
    void testSortByInconsistentPredicate() {
        List<Double> list = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            list.add(i % 5 == 0 ? Double.NaN : (i * 37 % 101) + 1.0);
        }
        List<Double> before = new ArrayList<>(list);
        SequenceView view = SequenceView.of(list);
        view.sortBy((a, b) -> a.compareTo(b.getValue(), "<"));
        assertEquals(100, list.size());
        List<Double> sorted = new ArrayList<>(list);
        sorted.sort(null);
        before.sort(null);
        assertEquals(before, sorted);
        view.sortBy((a, b) -> true);
        assertEquals(100, list.size());
    }

    @Test
    void testSortByIsStable() {
        List<DemoPerson> persons = new ArrayList<>(List.of(new DemoPerson("x", 2), new DemoPerson("y", 1),
                new DemoPerson("z", 2), new DemoPerson("w", 1)));
        SequenceView.of(persons).sortByField("age", true);
        assertEquals(List.of("y", "w", "x", "z"), names(persons));
    }

    @Test
    void testSortRefsByField() {
        List<Ref<DemoPerson>> refs = new ArrayList<>();
        for (DemoPerson person : persons()) {
            refs.add(Ref.of(person));
        }
        SequenceView.of(refs).sortByField("age", true);
        assertEquals(List.of("b", "c", "d"), refs.stream().map(r -> r.get().getName()).collect(Collectors.toList()));
    }

    @Test
    void testSortMapsByField() {
        List<Map<String, Object>> maps = new ArrayList<>(List.of(Map.of("n", 2), Map.of("n", 3), Map.of("n", 1)));
        SequenceView.of(maps).sortByField("n", false);
        assertEquals(List.of(Map.of("n", 3), Map.of("n", 2), Map.of("n", 1)), maps);
    }

    @Test
    void testSortByFieldFunc() {
        List<DemoPerson> persons = new ArrayList<>(List.of(
                new DemoPerson("ccc", 1), new DemoPerson("a", 2), new DemoPerson("bb", 3)));
        SequenceView.of(persons).sortByFieldFunc("name",
                (a, b) -> a.<String>getValue().length() < b.<String>getValue().length());
        assertEquals(List.of("a", "bb", "ccc"), names(persons));
    }

    @Test
    void testSortByFieldFailures() {
        SequenceView view = SequenceView.of(persons());
        ReflectException e = assertThrows(ReflectException.class, () -> view.sortByField("missing", true));
        assertEquals(ErrorKind.UNKNOWN_FIELD, e.getKind());
        e = assertThrows(ReflectException.class, () -> SequenceView.of(List.of(1, 2)).sortByField("x", true));
        assertEquals(ErrorKind.NOT_A_RECORD, e.getKind());
    }

    @Test
    void testSortByUnorderedFieldFails() {
        List<DemoPerson> persons = persons();
        for (DemoPerson person : persons) {
            person.setAddress(new DemoAddress(person.getName(), 1));
        }
        ReflectException e = assertThrows(ReflectException.class, () -> SequenceView.of(persons).sortByField("address", true));
        assertEquals(ErrorKind.INVALID_COMPARISON, e.getKind());
        assertEquals(List.of("c", "b", "d"), names(persons));
    }

}
