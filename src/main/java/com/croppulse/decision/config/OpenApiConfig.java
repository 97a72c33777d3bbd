package com.croppulse.decision.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cropPulseDecisionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CropPulse Decision Engine API")
                        .version("1.0.0")
                        .description(
                                "Weighted multi-source evidence aggregation for smallholder agriculture.\n\n" +
                                "**Composite credit score** (`POST /api/v1/credit-scores/{subjectId}`)\n" +
                                "- Traditional factors 40%, verified actions 30%, ground-truth reporting 30%\n" +
                                "- Score 0-1000, grade **A** (>=800), **B** (>=700), **C** (>=600), **D** (>=500), **F** (<500)\n\n" +
                                "**Claim verification** (`POST /api/v1/claims/verify`)\n" +
                                "- Satellite 30%, neighbor reports 40%, self reports 30%\n" +
                                "- Unavailable sources are dropped and the remaining weights renormalized\n" +
                                "- **APPROVE_STRONG** (>=80), **APPROVE** (>=60), **INVESTIGATE** (>=40), **REJECT** (<40)\n\n" +
                                "**Harvest logistics** (`GET /api/v1/harvest/{farmId}/assessment`)\n" +
                                "- Optimal harvest window, road risk, projected post-harvest loss and urgency\n\n" +
                                "Weights and thresholds are read-only at runtime (`GET /api/v1/config/weights`).")
                        .contact(new Contact().name("CropPulse Decision Team")));
    }
}
