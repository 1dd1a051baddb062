package io.hireflow.forms.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenAPIConfiguration {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Candidate Form Service")
                        .description("Form templates, candidate invitations, quotas and responses")
                        .version("v1"))
                .components(new Components()
                        .addParameters("recruiterId", new HeaderParameter()
                                .name("X-Recruiter-Id")
                                .required(true)
                                .schema(new StringSchema().format("uuid")))
                        .addParameters("organizationId", new HeaderParameter()
                                .name("X-Organization-Id")
                                .required(true)
                                .schema(new StringSchema().format("uuid"))));
    }
}
