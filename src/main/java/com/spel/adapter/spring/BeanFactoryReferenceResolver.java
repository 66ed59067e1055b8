package com.spel.adapter.spring;

import com.spel.variable.DefaultReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;

import java.util.Optional;

/**
 * Resolves {@code @name} and {@code &name} against a Spring bean factory.
 * Everything else behaves as in {@link DefaultReferenceResolver}.
 */
public class BeanFactoryReferenceResolver extends DefaultReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(BeanFactoryReferenceResolver.class);

    private final BeanFactory beanFactory;

    public BeanFactoryReferenceResolver(BeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public Optional<Object> resolveBean(String name, boolean factoryBean) {
        String beanName = factoryBean ? BeanFactory.FACTORY_BEAN_PREFIX + name : name;
        if (!beanFactory.containsBean(beanName)) {
            log.warn("Invalid bean reference: {}", beanName);
            return Optional.empty();
        }
        return Optional.ofNullable(beanFactory.getBean(beanName));
    }
}
