package com.inkblog.backend.auth.identity.password.service;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import com.inkblog.backend.auth.config.AppMailProperties;
import com.inkblog.backend.auth.config.PasswordResetProperties;

import lombok.RequiredArgsConstructor;

/**
 * 비밀번호 재설정 메일 발송 어댑터
 * - 정책(발급/검증)은 PasswordResetService, 여기는 SMTP I/O만 맡는다.
 */
@Component
@RequiredArgsConstructor
public class PasswordResetMailSender {

    private static final String SUBJECT = "[inkblog] 비밀번호 재설정 안내";

    private final JavaMailSender mailSender;
    private final PasswordResetProperties props;
    private final AppMailProperties mailProps;

    public void sendResetLink(String toEmail, String nickname, String rawToken) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setTo(toEmail);
        msg.setFrom(mailProps.from());
        msg.setSubject(SUBJECT);
        msg.setText(buildBody(nickname, rawToken));
        mailSender.send(msg);
    }

    private String buildBody(String nickname, String rawToken) {
        long minutes = props.ttlSeconds() / 60;
        return nickname + "님, 비밀번호 재설정을 요청하셨습니다.\n\n"
                + "아래 링크에서 새 비밀번호를 설정해주세요.\n"
                + props.linkBaseUrl() + rawToken + "\n\n"
                + minutes + "분 동안만 유효하며 한 번만 사용할 수 있습니다.\n"
                + "직접 요청하지 않았다면 이 메일은 무시하셔도 됩니다.";
    }
}
