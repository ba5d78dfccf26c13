package rollingplan.platform;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.orekit.utils.Constants;
import rollingplan.geometry.GeoPosition;
import rollingplan.helper.TestTargets;
import rollingplan.model.TrajectorySample;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeplerianPositionOracleTest {

    private static final double SEMI_MAJOR_AXIS = Constants.WGS84_EARTH_EQUATORIAL_RADIUS + 500_000.0;

    private KeplerianPositionOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new KeplerianPositionOracle(TestTargets.EPOCH);
        oracle.addPlatform(new PlatformOrbit("EQ", SEMI_MAJOR_AXIS, 0.0, 0.0, 0.0, 0.0, 0.0));
        oracle.addPlatform(new PlatformOrbit("INC", SEMI_MAJOR_AXIS, 0.0, 45.0, 0.0, 0.0, 0.0));
    }

    private static double periodSeconds() {
        return 2.0 * Math.PI * Math.sqrt(Math.pow(SEMI_MAJOR_AXIS, 3) / Constants.WGS84_EARTH_MU);
    }

    @Test
    void equatorialOrbitStartsAtReferencePoint() {
        GeoPosition position = oracle.positionOf("EQ", TestTargets.EPOCH);

        assertEquals(0.0, position.getLatitude(), 1e-6);
        assertEquals(0.0, position.getLongitude(), 1e-6);
        assertEquals(500.0, position.getAltitude(), 1e-3);
    }

    @Test
    void quarterPeriodMovesNinetyDegrees() {
        Instant later = TestTargets.EPOCH.plusMillis(Math.round(periodSeconds() * 250.0));

        GeoPosition position = oracle.positionOf("EQ", later);

        assertEquals(0.0, position.getLatitude(), 1e-6);
        assertEquals(90.0, position.getLongitude(), 1e-3);
    }

    @Test
    void inclinedOrbitReachesItsInclination() {
        Instant later = TestTargets.EPOCH.plusMillis(Math.round(periodSeconds() * 250.0));

        GeoPosition position = oracle.positionOf("INC", later);

        assertEquals(45.0, position.getLatitude(), 0.5);
    }

    @Test
    void unknownPlatformHasNoPosition() {
        assertNull(oracle.positionOf("nope", TestTargets.EPOCH));
        assertTrue(oracle.sampleGroundTrack("nope", TestTargets.EPOCH, TestTargets.EPOCH.plusSeconds(60), 10).isEmpty());
        assertFalse(oracle.hasPlatform("nope"));
    }

    @Test
    void groundTrackIsSampledInOrder() {
        List<TrajectorySample> track = oracle.sampleGroundTrack("EQ", TestTargets.EPOCH,
            TestTargets.EPOCH.plusSeconds(600), 60.0);

        assertTrue(track.size() >= 10, "samples: " + track.size());
        assertEquals(TestTargets.EPOCH, track.get(0).getTime());
        for (int i = 1; i < track.size(); i++) {
            assertTrue(track.get(i).getTime().isAfter(track.get(i - 1).getTime()));
            assertEquals(0.0, track.get(i).getPosition().getLatitude(), 1e-6);
        }
    }
}
