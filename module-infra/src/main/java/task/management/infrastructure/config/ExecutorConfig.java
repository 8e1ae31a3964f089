package task.management.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import task.management.infrastructure.executor.DefaultLogicExecutor;
import task.management.infrastructure.executor.LogicExecutor;
import task.management.infrastructure.executor.strategy.ExceptionTranslator;

/** LogicExecutor 구성. MeterRegistry가 없는 슬라이스 테스트에서는 SimpleMeterRegistry를 사용합니다. */
@Configuration
public class ExecutorConfig {

  @Bean
  public ExceptionTranslator defaultExceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  public LogicExecutor logicExecutor(
      ExceptionTranslator defaultExceptionTranslator, ObjectProvider<MeterRegistry> registry) {
    return new DefaultLogicExecutor(
        defaultExceptionTranslator, registry.getIfAvailable(SimpleMeterRegistry::new));
  }
}
