package com.example.trackscheduler.api.request;

import java.util.List;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class AddTracksRequest {

    @NotEmpty
    private List<String> paths;

    private String focusPath;
}
