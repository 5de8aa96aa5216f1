package com.inkblog.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.inkblog.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[로컬 기동]
================================================================================
export APP_AUTH_JWT_SECRET='local-dev-secret-must-be-at-least-32-bytes!!'
mvn -pl backend spring-boot:run
- MySQL(localhost:3306/inkblog)이 떠 있어야 한다. 스키마는 Flyway가 만든다.

================================================================================
[curl 시나리오 테스트]  (가입/로그인/refresh/me/logout 흐름 검증)
================================================================================
# 가입 201 (바로 토큰 쌍이 내려옴)
curl -i -X POST "http://localhost:8080/auth/register" \
  -H "Content-Type: application/json" \
  -d '{"email":"anna@inkblog.dev","password":"28482848a!","nickname":"Anna"}'

# 로그인 200
curl -s -X POST "http://localhost:8080/auth/login" \
  -H "Content-Type: application/json" \
  -H "User-Agent: Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)" \
  -d '{"email":"anna@inkblog.dev","password":"28482848a!"}'
- 응답: {"accessToken":"...","refreshToken":"...","expiresIn":900,"user":{...}}

# 내 정보 200
curl -s "http://localhost:8080/auth/me" -H "Authorization: Bearer <ACCESS>"

# refresh 200 (rotate=true면 refreshToken이 새 값으로 바뀐다)
curl -s -X POST "http://localhost:8080/auth/refresh" \
  -H "Content-Type: application/json" \
  -d '{"refreshToken":"<REFRESH>"}'

# 같은 refresh로 다시 호출 -> 401 REFRESH_INVALID (이미 로테이션됨)

# 로그아웃 204 (몇 번을 호출해도 204)
curl -i -X POST "http://localhost:8080/auth/logout" \
  -H "Content-Type: application/json" \
  -d '{"refreshToken":"<REFRESH>"}'

# 모든 기기 로그아웃 204
curl -i -X POST "http://localhost:8080/auth/logout-all" -H "Authorization: Bearer <ACCESS>"

# 비밀번호 변경 204 -> 이전 access는 PASSWORD_CHANGED, 모든 refresh는 REFRESH_INVALID
curl -i -X PUT "http://localhost:8080/auth/password" \
  -H "Authorization: Bearer <ACCESS>" -H "Content-Type: application/json" \
  -d '{"currentPassword":"28482848a!","newPassword":"newPass123!"}'

================================================================================
[DB 확인]
================================================================================
select id, user_id, active, revoke_reason, revoked_at, device_class, expires_at, last_used_at
  from refresh_tokens order by id desc;
- token_hash만 저장된다. 원문 refresh 토큰은 어디에도 남지 않는다.
 */
@EnableScheduling
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
