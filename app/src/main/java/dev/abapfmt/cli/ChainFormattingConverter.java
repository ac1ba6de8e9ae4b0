package dev.abapfmt.cli;

import dev.abapfmt.config.ChainFormatting;
import picocli.CommandLine;

public class ChainFormattingConverter implements CommandLine.ITypeConverter<ChainFormatting> {

    @Override
    public ChainFormatting convert(String value) {
        return ChainFormatting.from(value);
    }
}
