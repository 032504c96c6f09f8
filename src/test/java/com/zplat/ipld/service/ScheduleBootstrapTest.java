package com.zplat.ipld.service;

import com.zplat.ipld.entity.LparTarget;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.repository.LparTargetRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleBootstrapTest {

    @Mock LparTargetRepository lparTargetRepository;
    @Mock TaskService taskService;
    @InjectMocks ScheduleBootstrap bootstrap;

    @Test
    void parsesOptionalWeekday() {
        assertThat(ScheduleBootstrap.parseScheduleSpec("monday 09:00")).containsExactly("monday", "09:00");
        assertThat(ScheduleBootstrap.parseScheduleSpec(" 23:15 ")).containsExactly(null, "23:15");
        assertThatThrownBy(() -> ScheduleBootstrap.parseScheduleSpec("every monday 09:00"))
                .isInstanceOf(AppException.class);
    }

    @Test
    void registersEnabledTargetsAndSkipsBadRows() {
        LparTarget weekly = LparTarget.builder().id(1L).lpar("SYSA").schedule("friday 22:00").build();
        LparTarget daily = LparTarget.builder().id(2L).lpar("SYSB").schedule("06:00").build();
        LparTarget none = LparTarget.builder().id(3L).lpar("SYSC").schedule(" ").build();
        LparTarget broken = LparTarget.builder().id(4L).lpar("SYSD").schedule("a b c").build();
        when(lparTargetRepository.findByEnabledTrue()).thenReturn(List.of(weekly, daily, none, broken));

        bootstrap.run(null);

        verify(taskService).scheduleTask(1L, "22:00", "friday", false);
        verify(taskService).scheduleTask(2L, "06:00", null, false);
        verifyNoMoreInteractions(taskService);
    }
}
