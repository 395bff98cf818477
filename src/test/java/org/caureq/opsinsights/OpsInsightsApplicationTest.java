package org.caureq.opsinsights;

import org.caureq.opsinsights.service.context.ContextAssembler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class OpsInsightsApplicationTest {

    @Autowired
    ContextAssembler assembler;

    @Test
    void contextLoadsAndBuildsAnEmptyInfrastructureView() {
        var ctx = assembler.buildForInfrastructure();

        assertThat(ctx.resourceCount()).isZero();
        assertThat(ctx.learning().isAvailable()).isTrue();
    }
}
