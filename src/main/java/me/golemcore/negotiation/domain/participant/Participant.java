/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.negotiation.domain.participant;

import me.golemcore.negotiation.domain.model.ParticipantKind;

/**
 * One seat at the negotiation table. Produces text for its turn and nothing
 * else; appending to the transcript is the scheduler's job.
 */
public interface Participant {

    String getId();

    ParticipantKind getKind();

    /**
     * Produces the participant's next utterance. Blocks until the text is
     * available.
     *
     * @throws InterruptedException
     *             if the session task is interrupted while waiting
     * @throws me.golemcore.negotiation.domain.exception.CollaboratorException
     *             if a generated participant's collaborator fails
     * @throws me.golemcore.negotiation.domain.exception.SessionCancelledException
     *             if the session is stopped while a manual participant waits
     */
    String nextTurn(TurnContext context) throws InterruptedException;
}
