package dev.abapfmt.cli;

import dev.abapfmt.config.RunMode;
import picocli.CommandLine;

public class RunModeConverter implements CommandLine.ITypeConverter<RunMode> {

    @Override
    public RunMode convert(String value) {
        return RunMode.from(value);
    }
}
