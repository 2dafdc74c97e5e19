package Codify.grading.service.listener;

import Codify.grading.config.RabbitConfig;
import Codify.grading.model.GradingJob;
import Codify.grading.service.GradingJobService;
import Codify.grading.web.dto.GradingJobRequestDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class GradingRequestListener {
    private final GradingJobService gradingJobService;

    //submission service에서 push한 채점 요청 소비, REST 요청과 같은 형태
    @RabbitListener(queues = RabbitConfig.GRADING_QUEUE, containerFactory =
            "rabbitListenerContainerFactory")
    public void handleGradingRequest(GradingJobRequestDto message) {
        if (message == null || message.units() == null) {
            throw new AmqpRejectAndDontRequeueException("grading request without units");
        }
        log.info("Received grading request: {} files (student={})", message.units().size(), message.studentName());
        try {
            GradingJob job = gradingJobService.submit(message.toGradingRequest());
            log.info("Grading request queued as job {}", job.getId());
        } catch (Exception e) {
            log.error("Failed to process grading request", e);
            throw new AmqpRejectAndDontRequeueException("grading failed", e);
        }
    }
}
