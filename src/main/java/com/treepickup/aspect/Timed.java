package com.treepickup.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Times one stage of the partition pipeline. {@link TimingAspect} logs the
 * elapsed time under the operation name and keeps it for the controller to
 * report as the response's {@code elapsed} value.
 *
 * <pre>
 * &#64;Timed(value = "partition", logLevel = Timed.LogLevel.INFO)
 * public PartitionResult partition(PartitionRequest request)
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Pipeline operation name used in the log line, such as "partition";
     * defaults to Class#method
     */
    String value() default "";

    LogLevel logLevel() default LogLevel.DEBUG;

    enum LogLevel {
        DEBUG, INFO
    }
}
