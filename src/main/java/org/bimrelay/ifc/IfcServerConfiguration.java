package org.bimrelay.ifc;

import org.bimrelay.ifc.express.IfcValidator;
import org.bimrelay.ifc.express.StructuralValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;

/**
 * IFC 校验服务的 Bean 装配。
 * <p>
 * 校验器无状态，整个进程共享一个实例；GlobalId 检查的实体类型来自 {@code app.ifc.global-id-types}。
 */
@Configuration(proxyBeanMethods = false)
public class IfcServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(IfcServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public IfcValidator ifcValidator(IfcServerProperties properties) {
        return new IfcValidator(new StructuralValidator(new LinkedHashSet<>(properties.getGlobalIdTypes())));
    }
}
