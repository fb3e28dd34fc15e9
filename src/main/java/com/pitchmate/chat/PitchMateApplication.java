package com.pitchmate.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PitchMate 스크립트 코어 애플리케이션
 * 여행·레저 사업 아이디어 인터뷰 (관련성 필터 → 세그먼트 라우팅 → 스크립트 엔진 → 길이 제어)
 */
@SpringBootApplication
public class PitchMateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PitchMateApplication.class, args);
    }
}
