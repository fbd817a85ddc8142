package com.keyhive.participant;

import com.keyhive.participant.cli.ParticipantCli;

public class ParticipantApp {

    public static void main(String[] args) {
        System.exit(ParticipantCli.execute(args));
    }
}
