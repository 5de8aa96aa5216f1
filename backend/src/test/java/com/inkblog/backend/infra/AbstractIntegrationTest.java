package com.inkblog.backend.infra;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;

/**
 * 전체 컨텍스트 + MockMvc 통합 테스트 베이스.
 *
 * test 프로필은 H2(MySQL 모드)에 운영과 같은 Flyway 마이그레이션을 올린다.
 * 컨텍스트(및 DB)는 설정이 같은 테스트 클래스끼리 공유되므로,
 * 데이터 정리는 하위 클래스의 @BeforeEach 가 맡는다.
 *
 * 시계는 매 테스트 직전 TEST_START 로 되돌린다.
 * SMTP는 띄우지 않는다. JavaMailSender는 목이고, 보낸 메일은 ArgumentCaptor로 꺼내 본다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

    @MockBean protected JavaMailSender mailSender;

    @BeforeEach
    void rewindClock() {
        TestClockConfig.reset();
    }
}
