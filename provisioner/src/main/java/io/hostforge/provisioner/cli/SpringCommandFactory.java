package io.hostforge.provisioner.cli;

import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Lets picocli obtain commands from the application context, so they get
 * their services through the constructor. Anything that is not a bean
 * (converters, picocli's own help classes) goes to the default factory.
 */
@Component
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext context;

    public SpringCommandFactory(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        try {
            return context.getBean(cls);
        } catch (NoSuchBeanDefinitionException e) {
            return CommandLine.defaultFactory().create(cls);
        }
    }
}
