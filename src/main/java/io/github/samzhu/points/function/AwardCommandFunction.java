package io.github.samzhu.points.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.points.dto.AwardCommand;
import io.github.samzhu.points.dto.AwardRequest;
import io.github.samzhu.points.dto.AwardResult;
import io.github.samzhu.points.exception.InvalidActionException;
import io.github.samzhu.points.exception.StorageTransactionException;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.service.PointsEngine;

/**
 * 點數給予命令消費者函式配置。
 *
 * <p>上游服務（文件審核、問卷、排程）以 CloudEvents 發送命令，
 * Spring Cloud Stream 解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → {@link AwardCommand}</li>
 * </ul>
 *
 * <p>{@code userId} 未放在 data 時使用 CloudEvent {@code subject}；
 * CloudEvent {@code id} 作為交易的關聯 ID。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>未知動作、未知用戶：記錄後丟棄，重送也不會成功</li>
 *   <li>{@link StorageTransactionException}：重新拋出，由 binder 重送；重送的請求由冪等鍵去重</li>
 *   <li>其他錯誤：記錄後丟棄，避免重送迴圈</li>
 * </ul>
 *
 * <p>Binding name: {@code awardCommandConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class AwardCommandFunction {

    private static final Logger log = LoggerFactory.getLogger(AwardCommandFunction.class);

    private final PointsEngine pointsEngine;

    public AwardCommandFunction(PointsEngine pointsEngine) {
        this.pointsEngine = pointsEngine;
    }

    /**
     * 點數給予命令消費者 Bean。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<AwardCommand>> awardCommandConsumer() {
        return message -> {
            String eventId = CloudEventMessageUtils.getId(message);
            try {
                AwardCommand command = message.getPayload();
                String userId = command.userId() != null && !command.userId().isBlank()
                    ? command.userId()
                    : CloudEventMessageUtils.getSubject(message);

                log.debug("Award command received: id={}, type={}, source={}, userId={}, action={}",
                    eventId,
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    userId,
                    command.action());

                AwardResult result = pointsEngine.award(new AwardRequest(
                    userId,
                    command.action(),
                    command.metadata(),
                    command.source(),
                    eventId
                ));

                log.debug("Award command consumed: id={}, userId={}, applied={}",
                    eventId, userId, result.applied());
            } catch (InvalidActionException e) {
                log.warn("Award command dropped, unknown action: id={}, action={}", eventId, e.getAction());
            } catch (UnknownUserException e) {
                log.warn("Award command dropped, unknown user: id={}, userId={}", eventId, e.getUserId());
            } catch (StorageTransactionException e) {
                log.error("Award command failed, will be redelivered: id={}, error={}", eventId, e.getMessage());
                throw e;
            } catch (Exception e) {
                log.error("Failed to process award command: id={}, error={}", eventId, e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
