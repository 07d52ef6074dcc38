package com.phillippitts.dbprobe;

import com.phillippitts.dbprobe.config.web.RequestScopeFilter;
import com.phillippitts.dbprobe.service.connection.ConnectionManager;
import com.phillippitts.dbprobe.service.health.DatabaseHealthIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class DbProbeApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(ConnectionManager.class)).isNotNull();
        assertThat(context.getBean(RequestScopeFilter.class)).isNotNull();
        assertThat(context.getBean(DatabaseHealthIndicator.class)).isNotNull();
    }
}
