package io.expbin.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BinValueTest {

    @Test
    void bytes_compare_by_content_and_are_copied() {
        byte[] raw = {1, 2, 3};
        var v = (BinValue.BytesValue) BinValue.of(raw);
        raw[0] = 9;

        assertEquals(BinValue.of(new byte[]{1, 2, 3}), v);
        assertEquals(BinValue.of(new byte[]{1, 2, 3}).hashCode(), v.hashCode());

        byte[] out = v.value();
        out[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, v.value());
    }

    @Test
    void nested_collections_are_immutable_snapshots() {
        List<BinValue> items = new ArrayList<>(List.of(BinValue.of(1L)));
        var list = (BinValue.ListValue) BinValue.of(items);
        items.add(BinValue.of(2L));

        assertEquals(1, list.values().size());
        assertThrows(UnsupportedOperationException.class, () -> list.values().add(BinValue.nil()));
    }

    @Test
    void map_value_keeps_insertion_order() {
        Map<String, BinValue> m = new LinkedHashMap<>();
        m.put("z", BinValue.of(true));
        m.put("a", BinValue.of(1.5));
        m.put("m", BinValue.of("s"));

        var mv = (BinValue.MapValue) BinValue.of(m);

        assertEquals(List.of("z", "a", "m"), List.copyOf(mv.entries().keySet()));
        assertEquals(BinValue.of(Map.of("z", BinValue.of(true), "a", BinValue.of(1.5), "m", BinValue.of("s"))), mv);
    }

    @Test
    void null_members_are_rejected() {
        assertThrows(NullPointerException.class, () -> BinValue.of((String) null));
        List<BinValue> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(NullPointerException.class, () -> BinValue.of(withNull));
    }
}
