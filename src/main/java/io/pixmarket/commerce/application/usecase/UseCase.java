package io.pixmarket.commerce.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 애플리케이션 유스케이스 (요청 하나 = 유스케이스 하나)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
