package rollingplan.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * 规划结果输出
 *
 * 先创建会话，再在会话内保存数据和生成图表。
 */
public interface ReportSink {

    /**
     * 创建输出会话
     *
     * @param sessionName 会话名称
     * @return 会话ID
     */
    String createSession(String sessionName) throws IOException;

    /**
     * 保存规划数据
     *
     * @param data 数据
     * @param label 文件标签（不含扩展名）
     * @return 保存的文件
     * @throws IllegalStateException 尚未创建会话
     */
    Path saveData(Map<String, Object> data, String label) throws IOException;

    /**
     * 根据甘特图数据生成图表文件
     *
     * @param ganttData {@link PlanningGanttData} 生成的数据
     * @return 图表文件
     * @throws IllegalStateException 尚未创建会话
     */
    Path renderChart(Map<String, Object> ganttData) throws IOException;
}
