package com.example.orderbridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jms.core.JmsTemplate;

import jakarta.jms.ConnectionFactory;

/**
 * IBM MQ configuration.
 *
 * The connection factory is auto-configured by mq-jms-spring-boot-starter from:
 *   ibm.mq.queue-manager: QM1
 *   ibm.mq.channel: DEV.APP.SVRCONN
 *   ibm.mq.conn-name: localhost(1414)
 *   ibm.mq.user: app
 *   ibm.mq.password: passw0rd
 *
 * The source queue consumer uses the factory directly (transacted session);
 * the template is used for sends (destination queue, test messages).
 */
@Configuration
public class MqConfig {

    @Bean
    public JmsTemplate jmsTemplate(ConnectionFactory connectionFactory) {
        JmsTemplate template = new JmsTemplate(connectionFactory);
        template.setExplicitQosEnabled(true);
        template.setDeliveryPersistent(true);
        return template;
    }
}
