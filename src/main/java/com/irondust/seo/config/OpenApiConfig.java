package com.irondust.seo.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        String adminKeyName = "adminKey";
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("x-admin-key");

        return new OpenAPI()
                .info(new Info()
                        .title("IronDust SEO Optimizer API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API for multi-pass SEO validation and correction of generated content."))
                .components(new Components().addSecuritySchemes(adminKeyName, adminKeyScheme));
    }

    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList("adminKey");

            openAPI.getPaths().forEach((path, item) -> {
                if (path.startsWith("/seo/errors")) {
                    addRequirementToAllOperations(item, adminRequirement);
                }
                // Method-specific admin protection:
                if (path.equals("/seo/cache")) {
                    Operation delete = item.getDelete();
                    if (delete != null) delete.addSecurityItem(adminRequirement);
                }
                if (path.equals("/seo/cache/warm-up") || path.equals("/seo/titles")) {
                    Operation post = item.getPost();
                    if (post != null) post.addSecurityItem(adminRequirement);
                }
            });
        };
    }

    private static void addRequirementToAllOperations(PathItem item, SecurityRequirement requirement) {
        if (item.getGet() != null) item.getGet().addSecurityItem(requirement);
        if (item.getPost() != null) item.getPost().addSecurityItem(requirement);
        if (item.getPut() != null) item.getPut().addSecurityItem(requirement);
        if (item.getPatch() != null) item.getPatch().addSecurityItem(requirement);
        if (item.getDelete() != null) item.getDelete().addSecurityItem(requirement);
    }
}
