package Codify.grading.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
public class RabbitConfig {

    public static final String GRADING_QUEUE = "grading.queue";

    //exchange로 topic 사용 -> routing key로 채점 요청 구분
    @Bean
    public TopicExchange codifyExchange() {
        return new TopicExchange("codifyExchange");
    }

    //submission service -> grading service 메시지 큐
    @Bean
    public Queue gradingQueue() {
        return QueueBuilder.durable(GRADING_QUEUE).build();
    }

    @Bean
    public Binding gradingBinding() {
        return BindingBuilder
                .bind(gradingQueue())
                .to(codifyExchange())
                .with("grading.request");
    }

    //잘못된 메시지는 다시 큐에 넣지 않는다
    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            ConnectionFactory connectionFactory) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(new Jackson2JsonMessageConverter());
        factory.setDefaultRequeueRejected(false);
        return factory;
    }
}
