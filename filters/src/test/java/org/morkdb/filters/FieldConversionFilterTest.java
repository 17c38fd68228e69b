package org.morkdb.filters;

import org.morkdb.builder.MorkDatabaseBuilder;
import org.morkdb.model.MorkDatabase;
import org.morkdb.model.MorkRow;
import org.morkdb.model.MorkTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Field conversion filter")
class FieldConversionFilterTest {

    private static final String MESSAGES = "ns:msg:db:row:scope:msgs:all";

    private static final String SUMMARY = """
            // <!-- <mdb:mork:z v="1.4"/> -->
            < <(a=c)>
              (B8=subject)(B9=date)(BA=flags)(BB=priority)
              (80=ns:msg:db:row:scope:msgs:all)>

            <(91=Hello$20World)(92=4B5C1A2F)>

            {1:^80
              [1(^B8^91)(^B9^92)(^BA=10)(^BB=5)]
              [2(^B8=plain)(^BA=1)]}
            {2:^80 1}

            [1:other(flags=10)]
            """;

    private static final ConversionOptions UTC = ConversionOptions.defaults().withZone(ZoneOffset.UTC);

    @Test
    void convertsKnownFieldsOfKnownNamespaces() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource(SUMMARY);

        int converted = new FieldConversionFilter().process(db, UTC);

        assertEquals(4, converted);
        MorkRow first = db.row(MESSAGES, "1").orElseThrow();
        assertEquals(Map.of(
                "subject", "Hello World",
                "date", "Sun Jan 24 10:00:15 2010",
                "flags", "HasRe",
                "priority", "high"), first.cells());
        assertEquals("Read", db.row(MESSAGES, "2").orElseThrow().get("flags").orElseThrow());
    }

    @Test
    void rowsOutsideKnownNamespacesAreUntouched() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource(SUMMARY);
        new FieldConversionFilter().process(db, UTC);
        assertEquals("10", db.row("other", "1").orElseThrow().get("flags").orElseThrow());
    }

    @Test
    void conversionIsVisibleThroughEveryTable() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource(SUMMARY);
        new FieldConversionFilter().process(db, UTC);

        MorkTable second = db.table(MESSAGES, "2").orElseThrow();
        assertEquals("HasRe", db.rowsOf(second).get(0).get("flags").orElseThrow());
    }

    @Test
    void noConvertLeavesDatabaseAlone() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource(SUMMARY);

        int converted = new FieldConversionFilter().process(db, UTC.withNoConvert(true));

        assertEquals(0, converted);
        assertEquals("4B5C1A2F", db.row(MESSAGES, "1").orElseThrow().get("date").orElseThrow());
    }

    @Test
    void customRegistry() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource("[1:x(count=1F)(name=y)]");
        FieldConverterRegistry registry = new FieldConverterRegistry().register("x", "count", IntConverter.HEX);

        new FieldConversionFilter(registry).process(db, UTC);

        assertEquals(Map.of("count", "31", "name", "y"), db.row("x", "1").orElseThrow().cells());
    }

    @Test
    void malformedValueFails() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource(
                "< <(a=c)> (80=" + MESSAGES + ")> [1:^80(size=zz)]");

        FieldConversionException e = assertThrows(FieldConversionException.class,
                () -> new FieldConversionFilter().process(db, UTC));
        assertEquals(MESSAGES, e.getNamespace());
        assertEquals("size", e.getColumn());
        assertEquals("zz", e.getValue());
    }

    @Test
    void zoneBearingTimeFormatConvertsFormattedTimes() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource("[1:m(LastPurgeTime=Sat Jan 30 12:01:02 2010)]");
        FieldConverterRegistry registry = new FieldConverterRegistry().register("m", "LastPurgeTime",
                new FormattedTimeConverter(FormattedTimeConverter.CTIME_PATTERN));

        new FieldConversionFilter(registry).process(db,
                UTC.withZone(ZoneId.of("UTC")).withTimeFormat("yyyy-MM-dd HH:mm VV"));

        assertEquals("2010-01-30 12:01 UTC", db.row("m", "1").orElseThrow().get("LastPurgeTime").orElseThrow());
    }

    @Test
    void unrenderableTimeFailsWithFieldContext() {
        MorkDatabase db = MorkDatabaseBuilder.fromSource("[1:m(MRUTime=9223372036854775807)]");
        FieldConverterRegistry registry = new FieldConverterRegistry().register("m", "MRUTime", SecondsConverter.SECONDS);

        FieldConversionException e = assertThrows(FieldConversionException.class,
                () -> new FieldConversionFilter(registry).process(db, UTC));
        assertEquals("m", e.getNamespace());
        assertEquals("MRUTime", e.getColumn());
        assertEquals("9223372036854775807", e.getValue());
    }

    @Test
    void defaultRegistryKnowsThunderbirdFields() {
        FieldConverterRegistry registry = FieldConverterRegistry.defaults();
        assertTrue(registry.converterFor("ns:addrbk:db:row:scope:card:all", "PreferMailFormat").isPresent());
        assertTrue(registry.converterFor("ns:history:db:row:scope:history:all", "Typed").isPresent());
        assertTrue(registry.converterFor("m", "threadFlags").isPresent());
        assertTrue(registry.converterFor(MESSAGES, "subject").isEmpty());
        assertTrue(registry.convertersFor("unknown").isEmpty());
    }
}
