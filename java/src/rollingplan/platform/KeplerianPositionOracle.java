package rollingplan.platform;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.attitudes.FrameAlignedProvider;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.orbits.KeplerianOrbit;
import org.orekit.orbits.Orbit;
import org.orekit.orbits.PositionAngleType;
import org.orekit.propagation.analytical.KeplerianPropagator;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;
import rollingplan.geometry.GeoPosition;
import rollingplan.helper.GroundTrackRecorder;
import rollingplan.model.TrajectorySample;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 开普勒轨道位置预报
 *
 * 使用Orekit开普勒运动外推平台位置。参考时刻映射到J2000历元，
 * 不依赖地球定向参数等外部数据；默认以GCRF作为地球模型的本体坐标系（简化地球模型）。
 */
public class KeplerianPositionOracle implements PlatformPositionOracle {

    private static final Logger logger = Logger.getLogger(KeplerianPositionOracle.class.getName());

    // 地球物理常数
    private static final double EARTH_RADIUS = Constants.WGS84_EARTH_EQUATORIAL_RADIUS;
    private static final double EARTH_FLATTENING = Constants.WGS84_EARTH_FLATTENING;
    private static final double MU = Constants.WGS84_EARTH_MU;

    private final Instant referenceEpoch;
    private final AbsoluteDate referenceDate;
    private final Frame inertialFrame;
    private final OneAxisEllipsoid earth;

    // 轨道对象不可变，并行查询无需加锁
    private final Map<String, Orbit> orbits = new ConcurrentHashMap<>();

    /**
     * 创建位置预报（简化地球模型）
     *
     * @param referenceEpoch 轨道根数对应的参考时刻
     */
    public KeplerianPositionOracle(Instant referenceEpoch) {
        this(referenceEpoch, FramesFactory.getGCRF());
    }

    /**
     * 创建位置预报
     *
     * @param referenceEpoch 轨道根数对应的参考时刻
     * @param bodyFrame 地球模型的本体坐标系
     */
    public KeplerianPositionOracle(Instant referenceEpoch, Frame bodyFrame) {
        this.referenceEpoch = referenceEpoch;
        this.referenceDate = AbsoluteDate.J2000_EPOCH;
        this.inertialFrame = FramesFactory.getGCRF();
        this.earth = new OneAxisEllipsoid(EARTH_RADIUS, EARTH_FLATTENING, bodyFrame);
    }

    /**
     * 添加平台轨道
     *
     * @param platformOrbit 轨道参数
     */
    public void addPlatform(PlatformOrbit platformOrbit) {
        KeplerianOrbit orbit = new KeplerianOrbit(
            platformOrbit.getSemiMajorAxis(),
            platformOrbit.getEccentricity(),
            Math.toRadians(platformOrbit.getInclination()),
            Math.toRadians(platformOrbit.getArgOfPerigee()),
            Math.toRadians(platformOrbit.getRaan()),
            Math.toRadians(platformOrbit.getMeanAnomaly()),
            PositionAngleType.MEAN,
            inertialFrame,
            referenceDate,
            MU
        );
        orbits.put(platformOrbit.getPlatformId(), orbit);
    }

    @Override
    public GeoPosition positionOf(String platformId, Instant time) {
        Orbit orbit = orbits.get(platformId);
        if (orbit == null) {
            logger.fine(() -> "未知平台: " + platformId);
            return null;
        }
        try {
            AbsoluteDate date = toDate(time);
            Orbit shifted = orbit.shiftedBy(date.durationFrom(orbit.getDate()));
            Vector3D position = shifted.getPVCoordinates(earth.getBodyFrame()).getPosition();
            return toGeoPosition(earth.transform(position, earth.getBodyFrame(), date));
        } catch (OrekitException e) {
            logger.log(Level.WARNING, "平台 " + platformId + " 位置外推失败", e);
            return null;
        }
    }

    /**
     * 采样平台星下点轨迹
     *
     * @param platformId 平台ID
     * @param start 开始时刻
     * @param end 结束时刻
     * @param stepSeconds 采样步长（秒）
     * @return 轨迹采样点；未知平台返回空列表
     */
    public List<TrajectorySample> sampleGroundTrack(String platformId, Instant start, Instant end,
                                                    double stepSeconds) {
        Orbit orbit = orbits.get(platformId);
        if (orbit == null) {
            return Collections.emptyList();
        }

        // 每次采样使用独立的传播器
        KeplerianPropagator propagator = new KeplerianPropagator(orbit, new FrameAlignedProvider(inertialFrame));
        GroundTrackRecorder recorder = new GroundTrackRecorder(earth, referenceEpoch, referenceDate);
        propagator.setStepHandler(stepSeconds, recorder);
        propagator.propagate(toDate(start), toDate(end));

        return recorder.getSamples();
    }

    public boolean hasPlatform(String platformId) {
        return orbits.containsKey(platformId);
    }

    private AbsoluteDate toDate(Instant time) {
        Duration offset = Duration.between(referenceEpoch, time);
        return referenceDate.shiftedBy(offset.getSeconds() + offset.getNano() / 1e9);
    }

    /**
     * 大地坐标转换为地理位置（度、公里）
     */
    public static GeoPosition toGeoPosition(GeodeticPoint point) {
        return new GeoPosition(
            Math.toDegrees(point.getLatitude()),
            Math.toDegrees(point.getLongitude()),
            point.getAltitude() / 1000.0
        );
    }
}
