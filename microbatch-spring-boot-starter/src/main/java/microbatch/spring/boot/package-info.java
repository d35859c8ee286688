/**
 * Spring Boot auto-configuration for the micro-batching engine.
 *
 * <p>Bind {@code microbatch.*} properties through
 * {@link microbatch.spring.boot.MicroBatchProperties}; declare a
 * {@link microbatch.JobProcessor} bean and a started {@link microbatch.MicroBatcher} is
 * created around it.
 */
package microbatch.spring.boot;
