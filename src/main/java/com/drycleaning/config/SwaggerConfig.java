package com.drycleaning.config;

import com.drycleaning.api.ApiHeaders;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 문서 설정
 *
 * API 인터페이스는 X-Account-Id 헤더를 문서에서 숨기고, 대신 전역 보안 스키마로 노출합니다.
 * Swagger UI의 Authorize에 계정 ID를 넣으면 모든 요청에 헤더가 붙습니다.
 */
@Configuration
public class SwaggerConfig {

    static final String ACCOUNT_SCHEME = "accountId";

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dry Cleaning Shop API")
                        .description("세탁소 주문 접수/상태 관리, 카탈로그와 가격표, 고객 포인트, 주소록, 알림 API")
                        .version("v1.0.0"))
                .components(new Components()
                        .addSecuritySchemes(ACCOUNT_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(ApiHeaders.ACCOUNT_ID)
                                .description("요청 계정 ID. 역할(고객/직원/점주/관리자)과 소속 매장은 이 값으로 판별합니다.")))
                .addSecurityItem(new SecurityRequirement().addList(ACCOUNT_SCHEME));
    }

    @Bean
    public GroupedOpenApi shopOperationsApi() {
        return GroupedOpenApi.builder()
                .group("shop-operations")
                .displayName("매장 운영 (주문/카탈로그/직원/고객)")
                .pathsToMatch("/api/shops/**", "/api/orders/**")
                .build();
    }

    @Bean
    public GroupedOpenApi customerApi() {
        return GroupedOpenApi.builder()
                .group("customer")
                .displayName("고객 (포인트/주소록/알림)")
                .pathsToMatch("/api/customers/**", "/api/orders/me", "/api/notifications/**")
                .build();
    }
}
