package com.phillippitts.scalogram;

import com.phillippitts.scalogram.config.properties.BatchProperties;
import com.phillippitts.scalogram.config.properties.OutputProperties;
import com.phillippitts.scalogram.config.properties.RenderProperties;
import com.phillippitts.scalogram.config.properties.TransformProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        TransformProperties.class,
        RenderProperties.class,
        BatchProperties.class,
        OutputProperties.class
})
public class ScalogramApplication {

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication app = new SpringApplication(ScalogramApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

}
