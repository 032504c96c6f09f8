package com.zplat.ipld.common;

import java.util.List;

public class Constants {
    public interface CIRRUS {
        String HEADER_API_KEY = "x-api-key";
    }

    public interface EVENT {
        String TASK_PROGRESS = "task_progress";
        String DRY_RUN = "dry_run";
    }

    public interface PAYLOAD {
        String DRIVER = "main.sh";
        // upload order matters: the driver sources the helpers
        List<String> FILES = List.of(
                "ipld_calc.awk",
                "ipld_parsing.awk",
                "patterns",
                DRIVER,
                "methods.sh"
        );
        String RESULT_GLOB = "*.CSV";
    }

    public interface REMOTE {
        String HOME_PWD = "cd $HOME; pwd 2>&1";
        String TMP_USAGE = "df -kP /tmp | tail -1 | awk '{print $5}'";
        String DATASET_COUNT = "check=$(tsocmd \"listcat level(%s)\" | grep NONVSAM"
                + " | egrep \"LOG|BLDR01\" | tail -2 | head -1 | cut -d\" \" -f3)"
                + " && head -1000 \"//'$check'\" | wc -l 2>&1";
    }
}
