package de.upb.sse.jrefactor.configuration;

import lombok.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class JRefactorConfiguration {
    private boolean failOnParseError = false;
    // how many levels of field types are expanded into Type.Class members
    private int memberDepth = 1;
    private String languageLevel = "JAVA_17";
    private String charset = "UTF-8";
    private List<Path> classpath = new ArrayList<>();

    public JRefactorConfiguration(boolean failOnParseError, int memberDepth) {
        this.failOnParseError = failOnParseError;
        this.memberDepth = memberDepth;
    }
}
