package me.internalizable.quickplay.support;

import me.internalizable.quickplay.QuickplayCollaborators;
import me.internalizable.quickplay.QuickplayService;
import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.store.InMemoryKeyValueStore;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * A service wired to fakes, listing five servers:
 *
 * <ul>
 *   <li>{@link #BUSY}: cp_testmap at its peak population, answers probes</li>
 *   <li>{@link #QUIET}: koth variant with a few players, answers probes</li>
 *   <li>{@link #CUSTOM}: unknown cp_ map</li>
 *   <li>{@link #SILENT}: valid but never answers a probe</li>
 *   <li>{@link #RELAY}: relay address</li>
 * </ul>
 */
public final class ServiceHarness {

    public static final String BUSY = "85568392920040001";
    public static final String QUIET = "85568392920040002";
    public static final String CUSTOM = "85568392920040003";
    public static final String SILENT = "85568392920040004";
    public static final String RELAY = "85568392920040005";

    public static final GeoLocation FRANKFURT = new GeoLocation("DE", "EU", 50.11, 8.68);

    public final QuickplayConfig config;
    public final FakeDirectory directory = new FakeDirectory();
    public final FakeSchemaSource schemaSource =
            new FakeSchemaSource(Fixtures.SCHEMA_IDENTITY, Fixtures.SCHEMA_DOCUMENT, Fixtures.MINIMUM_VERSION);
    public final FakeProbe probe = new FakeProbe();
    public final FakeGeoLocator geoLocator = new FakeGeoLocator();
    public final RecordingConsumer consumer = new RecordingConsumer();
    public final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    public final MutableClock clock = new MutableClock(Fixtures.MARCH);
    public final QuickplayService service;

    public ServiceHarness(Path tempDir) {
        config = Fixtures.config(tempDir);

        directory.setServers(List.of(
                Fixtures.server("203.0.113.10:27015", BUSY, "cp_testmap", "cp", 17, 24),
                Fixtures.server("203.0.113.11:27015", QUIET, "koth_testhill_rc2", "koth", 5, 24),
                Fixtures.server("203.0.113.12:27015", CUSTOM, "cp_unknownmap", "cp", 10, 24),
                Fixtures.server("203.0.113.13:27015", SILENT, "cp_testmap", "cp", 12, 24),
                Fixtures.server("169.254.1.1:27015", RELAY, "cp_testmap", "cp", 12, 24)
        ));

        probe.answer("203.0.113.10:27015", Fixtures.live("cp_testmap", "cp", 17, 24))
                .answer("203.0.113.11:27015", Fixtures.live("koth_testhill_rc2", "koth", 5, 24))
                .silence("203.0.113.13:27015");

        for (int i = 10; i <= 13; i++) {
            geoLocator.locate("203.0.113." + i, FRANKFURT);
        }

        service = new QuickplayService(
                config,
                Fixtures.tables(),
                new QuickplayCollaborators(directory, schemaSource, probe, geoLocator, consumer, store),
                clock,
                new Random(1)
        );
    }
}
