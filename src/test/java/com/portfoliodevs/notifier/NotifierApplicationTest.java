package com.portfoliodevs.notifier;

import com.portfoliodevs.notifier.scheduler.DelayedJobScheduler;
import com.portfoliodevs.notifier.scheduler.JobStore;
import com.portfoliodevs.notifier.scheduler.NoopJobStore;
import com.portfoliodevs.notifier.service.ChannelRoutingNotificationSender;
import com.portfoliodevs.notifier.service.NotificationSender;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
class NotifierApplicationTest {

    @Autowired
    private DelayedJobScheduler scheduler;

    @Autowired
    private NotificationSender notificationSender;

    @Autowired
    private JobStore jobStore;

    @Autowired
    @Qualifier("emailRestTemplate")
    private RestTemplate emailRestTemplate;

    @Test
    void contextLoads_WithRoutingSenderAndInMemoryStore() {
        assertThat(notificationSender).isInstanceOf(ChannelRoutingNotificationSender.class);
        assertThat(jobStore).isInstanceOf(NoopJobStore.class);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void emailRestTemplate_UsesBootMessageConverters() {
        assertThat(emailRestTemplate.getMessageConverters())
                .hasAtLeastOneElementOfType(MappingJackson2HttpMessageConverter.class);
    }
}
