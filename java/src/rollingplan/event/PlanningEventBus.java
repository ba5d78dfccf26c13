package rollingplan.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 进程内事件通道
 *
 * 进度与状态变化通过显式的发布/订阅传递。订阅者抛出的异常只记录日志，
 * 不影响发布方和其他订阅者。
 */
public class PlanningEventBus {

    private static final Logger logger = Logger.getLogger(PlanningEventBus.class.getName());

    private final List<Consumer<PlanningEvent>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * 发布事件
     *
     * @param event 事件
     */
    public void publish(PlanningEvent event) {
        logger.finer(() -> "发布事件: " + event);
        for (Consumer<PlanningEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * 订阅所有事件
     *
     * @param consumer 事件回调
     * @return 取消订阅句柄
     */
    public Subscription subscribe(Consumer<PlanningEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    /**
     * 订阅指定类型的事件
     */
    public Subscription subscribe(String eventType, Consumer<PlanningEvent> consumer) {
        return subscribe(event -> {
            if (eventType.equals(event.getEventType())) {
                consumer.accept(event);
            }
        });
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * 取消订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PlanningEvent> subscriber, PlanningEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "订阅者处理事件 " + event.getEventType() + " 时异常", e);
        }
    }
}
