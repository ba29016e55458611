package com.phillippitts.truthtell;

import com.phillippitts.truthtell.config.IntegrationTestConfiguration;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

@Tag("integration")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest
class TruthTellApplicationTests {

    @Test
    void contextLoads() {
    }

}
