package com.ops.alertdecision.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI alertDecisionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Alert Decision API")
                        .version("1.0.0")
                        .description(
                                "Decides, per operational alert, whether to forward it to on-call or suppress it as noise.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Receive alert via `POST /alerts/process`\n" +
                                "2. Duplicate check: same host/title/severity inside the duplicate window\n" +
                                "3. Pattern checks: flapping (status transitions) and self-resolution (quick clears over 7 days)\n" +
                                "4. Suppression classifier, unless step 2 or 3 already signals suppression\n" +
                                "5. Policy, first match wins: duplicate → flapping → self-resolving → critical → classifier → default forward\n" +
                                "6. Audit entry, history append, notification for forwarded alerts\n\n" +
                                "**Reasons:** `duplicate_alert`, `flapping_alert`, `self_resolving_alert`, " +
                                "`critical_alert_always_forward`, `ml_prediction_confidence_<p>`, " +
                                "`default_forward_no_strong_suppress`, `error_in_decision_<message>`")
                        .contact(new Contact().name("Alerting Platform Team")));
    }
}
