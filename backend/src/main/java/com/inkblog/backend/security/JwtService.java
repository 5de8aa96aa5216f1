package com.inkblog.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;
 
import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.domain.UserRole; 

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT) 발급/검증 서비스 (Token Codec)
 * 
 * - HTTP(상태코드/응답)는 모른다. "유효/무효"만 판단한다.
 * - DB도 모른다. 서명 검증만으로 "내가 발급한 토큰"인지 확인한다. (유저 상태 확인은 AccessTokenAuthenticator)
 * - 검증 실패는 InvalidJwtException 하나로 통일한다.
 *   만료 여부(expired)는 사용자 안내 메시지용으로만 실어 보내고, 신뢰 판단에는 쓰지 않는다.
 * 
 * 기능:
 * - 발급: issueAccessToken(userId, role, emailVerified)
 * - 검증: verifyAccessToken(token) -> AccessClaims
 * 
 * JWT payload:
 * - iss: 발급자 (app.auth.jwt.issuer)
 * - aud: 사용 대상 (app.auth.jwt.audience)
 * - sub: userId
 * - role: "USER" / "AUTHOR" / "ADMIN"
 * - emailVerified: 발급 시점의 메일 인증 여부
 * - iat/exp: 발급/만료 (초 단위)
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";
    private static final String EMAIL_VERIFIED_CLAIM = "emailVerified";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;


    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        // secret length 검증 + 키 생성 (부족하면 기동 자체를 실패시킨다)
        this.key = buildHmacKey(jwtProps.secret()); 

        // issuer(iss) + audience(aud) 고정으로 타 서비스/타 용도 토큰을 차단한다.
        this.parser = buildParser(jwtProps.issuer(), jwtProps.audience(), this.key, this.clock);
    }


    /** userId/role/emailVerified 기반 Access JWT 발급 */
    public String issueAccessToken(Long userId, UserRole role, boolean emailVerified) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());
        
        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                // iss
                .setAudience(jwtProps.audience())            // aud
                .setSubject(String.valueOf(userId))          // sub
                .claim(ROLE_CLAIM, role.name())              // role: "USER"
                .claim(EMAIL_VERIFIED_CLAIM, emailVerified)  // emailVerified: true
                .setIssuedAt(Date.from(now))                 // iat
                .setExpiration(Date.from(exp))               // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();               
    }

    public long accessTtlSeconds() {
        return jwtProps.accessTtlSeconds();
    }
    
    /**
     * Access Token 검증 후, AccessClaims 반환
     * 
     * 실패 시 InvalidJwtException을 던진다.
     * - 서명/issuer/audience/만료/포맷 중 하나라도 실패하면 실패
     */
    public AccessClaims verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidJwtException("Blank JWT", null, false);
        }
        try {
            return toAccessClaims(parser.parseClaimsJws(token).getBody());
        } catch (ExpiredJwtException e) {
            throw new InvalidJwtException("Expired JWT", e, true);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e, false);
        }
    }


    private static SecretKey buildHmacKey(String secret) {
        byte[] bytes = (secret == null) ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, String audience, SecretKey key, Clock clock) {
        requireText(issuer, "JWT issuer");
        requireText(audience, "JWT audience");

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .requireAudience(audience)
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant())) // jjwt 0.11은 Date 기반 Clock
                .build();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must not be blank");
        }
    }

    // sub / role / emailVerified / iat / exp -> AccessClaims. 형식이 틀리면 JwtException
    private static AccessClaims toAccessClaims(Claims claims) {
        String sub = claims.getSubject();
        if (sub == null || sub.isEmpty() || !sub.chars().allMatch(Character::isDigit)) {
            throw new JwtException("sub is not a numeric user id: " + sub);
        }
        if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
            throw new JwtException("iat/exp claim missing");
        }

        return new AccessClaims(
                Long.valueOf(sub),
                roleOf(claims.get(ROLE_CLAIM, String.class)),
                Boolean.TRUE.equals(claims.get(EMAIL_VERIFIED_CLAIM, Boolean.class)),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        );
    }

    // "USER" 형태가 정상. Spring Security 관례인 "ROLE_USER"도 받아준다.
    private static UserRole roleOf(String raw) {
        String name = (raw != null && raw.startsWith("ROLE_")) ? raw.substring(5) : raw;
        for (UserRole r : UserRole.values()) {
            if (r.name().equals(name)) return r;
        }
        throw new JwtException("role claim invalid: " + raw);
    }

    /**
     * 서명 검증을 통과한 Access Token의 클레임
     */
    public record AccessClaims(
            Long userId,
            UserRole role,
            boolean emailVerified,
            Instant issuedAt,
            Instant expiresAt
    ) {}

    /**
     * HTTP 레벨과 분리된 “JWT 검증 실패” 도메인 예외
     * - expired: 서명은 맞지만 exp가 지난 경우 true (안내 문구 분기용)
     */
    public static class InvalidJwtException extends RuntimeException {
        private final boolean expired;

        public InvalidJwtException(String message, Throwable cause, boolean expired) {
            super(message, cause);
            this.expired = expired;
        }

        public boolean isExpired() {
            return expired;
        }
    }

}
