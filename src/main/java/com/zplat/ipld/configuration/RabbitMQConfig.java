package com.zplat.ipld.configuration;

import com.zplat.ipld.common.Constants;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class RabbitMQConfig {

    public static final String EXCHANGE            = "ipld.progress";
    public static final String TASK_PROGRESS_QUEUE = "ipld.task_progress";
    public static final String DRY_RUN_QUEUE       = "ipld.dry_run";

    // ====== ConnectionFactory ======
    @Bean(name = "rabbitConnectionFactory")
    @Primary
    public ConnectionFactory rabbitConnectionFactory(RabbitProperties props) {
        CachingConnectionFactory cf = new CachingConnectionFactory(props.getHost(), props.getPort());
        cf.setUsername(props.getUsername());
        cf.setPassword(props.getPassword());
        if (props.getVirtualHost() != null) {
            cf.setVirtualHost(props.getVirtualHost());
        }
        return cf;
    }

    // ====== Exchange / Queue / Binding ======
    @Bean
    public TopicExchange progressExchange() {
        return new TopicExchange(EXCHANGE);
    }

    @Bean
    public Queue taskProgressQueue() {
        return new Queue(TASK_PROGRESS_QUEUE, true);
    }

    @Bean
    public Queue dryRunQueue() {
        return new Queue(DRY_RUN_QUEUE, true);
    }

    @Bean
    public Binding taskProgressBinding(Queue taskProgressQueue, TopicExchange progressExchange) {
        return BindingBuilder.bind(taskProgressQueue).to(progressExchange).with(Constants.EVENT.TASK_PROGRESS);
    }

    @Bean
    public Binding dryRunBinding(Queue dryRunQueue, TopicExchange progressExchange) {
        return BindingBuilder.bind(dryRunQueue).to(progressExchange).with(Constants.EVENT.DRY_RUN);
    }

    // ====== Converter JSON ======
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(
            @Qualifier("rabbitConnectionFactory") ConnectionFactory connectionFactory,
            @Qualifier("jsonMessageConverter") MessageConverter messageConverter
    ) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        return template;
    }

    @Bean
    public RabbitAdmin defaultRabbitAdmin(
            @Qualifier("rabbitConnectionFactory") ConnectionFactory connectionFactory
    ) {
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);
        admin.setAutoStartup(true);
        admin.setIgnoreDeclarationExceptions(true);
        return admin;
    }
}
