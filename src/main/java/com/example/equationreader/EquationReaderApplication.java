package com.example.equationreader;

import com.example.equationreader.config.EquationReaderProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Equation Reader API",
                version = "1.0",
                description = "REST API that recognizes equation images and repairs the LaTeX into validated, calculator-ready expressions.",
                contact = @Contact(name = "Equation Reader")))
@SpringBootApplication
@EnableConfigurationProperties(EquationReaderProperties.class)
public class EquationReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(EquationReaderApplication.class, args);
    }
}
