package com.wflint.spring;

import com.wflint.adapter.spring.ExpressionLintAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the expression front end beans in a Spring application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableExpressionLint
 * public class LinterApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(LinterApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ExpressionLintAutoConfiguration.class)
public @interface EnableExpressionLint {
}
