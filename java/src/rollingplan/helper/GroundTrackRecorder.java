package rollingplan.helper;

import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.propagation.SpacecraftState;
import org.orekit.propagation.sampling.OrekitFixedStepHandler;
import org.orekit.time.AbsoluteDate;
import rollingplan.model.TrajectorySample;
import rollingplan.platform.KeplerianPositionOracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GroundTrackRecorder - 星下点轨迹收集器
 *
 * 实现OrekitFixedStepHandler接口，在传播过程中按固定步长记录平台的
 * 地理位置，传播结束后一次性返回采样列表。
 *
 * 时间映射：AbsoluteDate相对参考日期的偏移量加到参考时刻上。
 */
public class GroundTrackRecorder implements OrekitFixedStepHandler {

    private final OneAxisEllipsoid earth;
    private final Instant referenceEpoch;
    private final AbsoluteDate referenceDate;
    private final List<TrajectorySample> samples = new ArrayList<>();

    public GroundTrackRecorder(OneAxisEllipsoid earth, Instant referenceEpoch, AbsoluteDate referenceDate) {
        this.earth = earth;
        this.referenceEpoch = referenceEpoch;
        this.referenceDate = referenceDate;
    }

    /**
     * 处理每一步的轨道状态
     *
     * @param currentState 当前轨道状态
     */
    @Override
    public void handleStep(SpacecraftState currentState) {
        AbsoluteDate date = currentState.getDate();
        samples.add(new TrajectorySample(
            KeplerianPositionOracle.toGeoPosition(
                earth.transform(currentState.getPVCoordinates(earth.getBodyFrame()).getPosition(),
                              earth.getBodyFrame(), date)
            ),
            toInstant(date)
        ));
    }

    /**
     * 获取所有收集的采样点
     */
    public List<TrajectorySample> getSamples() {
        return new ArrayList<>(samples);
    }

    private Instant toInstant(AbsoluteDate date) {
        long nanos = Math.round(date.durationFrom(referenceDate) * 1e9);
        return referenceEpoch.plusNanos(nanos);
    }
}
