package com.initialone.jqport;

import com.initialone.jqport.commands.BatchCmd;
import com.initialone.jqport.commands.ConvertCmd;
import com.initialone.jqport.commands.TableCmd;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jqport",
        version = "0.4.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = "Convert JoinQuant strategy scripts into PTrade strategy scripts.",
        subcommands = {
                ConvertCmd.class,
                BatchCmd.class,
                TableCmd.class
        }
)
public class Main implements Runnable {

    /** 源脚本超出支持的语法范围 */
    public static final int EXIT_PARSE = 1;
    /** 变体 / 覆盖表 / 文件读写错误 */
    public static final int EXIT_CONFIG = 2;

    @Override
    public void run() {
        System.out.println("Use a subcommand. Try --help.");
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
