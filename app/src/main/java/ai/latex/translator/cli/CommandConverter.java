package ai.latex.translator.cli;

import ai.latex.translator.config.Command;
import picocli.CommandLine;

public class CommandConverter implements CommandLine.ITypeConverter<Command> {

    @Override
    public Command convert(String value) {
        return Command.from(value);
    }
}
